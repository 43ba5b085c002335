package com.labvault.lims.dto;

import java.util.List;

public record SequencingImportRequest(RunMetadata run, List<SequencingRowInput> rows) {}
