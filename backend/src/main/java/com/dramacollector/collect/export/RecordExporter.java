package com.dramacollector.collect.export;

import com.dramacollector.collect.model.ExportFileInfo;
import com.dramacollector.collect.model.ExportOptions;
import com.dramacollector.collect.model.ValidatedRecord;

import java.util.List;

public interface RecordExporter {
    /**
     * Writes one file per format.
     *
     * @throws ExportFailureException for an unknown format or any write failure
     */
    List<ExportFileInfo> export(List<ValidatedRecord> records, List<String> formats, ExportOptions options);
}
