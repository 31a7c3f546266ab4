package io.dynaform.core.spi;

import io.dynaform.core.model.MetadataRecord;
import java.util.List;

/**
 * Inbound collaborator that supplies the raw metadata rows a form is built from. Remote queries,
 * files and in-memory fixtures all sit behind this interface.
 */
public interface MetadataSource {

    /**
     * Identifies the form or query these rows describe; used in logs and error reports.
     *
     * @return a short identifier, never null
     */
    String formId();

    /**
     * Fetches all metadata rows.
     *
     * @return rows in upstream order
     * @throws io.dynaform.core.error.MetadataSourceException if the upstream source reports a
     *     failure
     */
    List<MetadataRecord> fetch();
}
