package com.labvault.lims.dto;

/** A row that was not persisted, or was persisted without a link. rowIndex is 1-based. */
public record ImportRowError(int rowIndex, String facilitySampleName, String error) {}
