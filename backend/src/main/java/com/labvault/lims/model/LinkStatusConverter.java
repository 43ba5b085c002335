package com.labvault.lims.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class LinkStatusConverter implements AttributeConverter<LinkStatus, String> {
    @Override
    public String convertToDatabaseColumn(LinkStatus attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public LinkStatus convertToEntityAttribute(String dbData) {
        return LinkStatus.fromCode(dbData);
    }
}
