package com.scorestats.platform.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class BeatmapOnlineStatusConverter implements AttributeConverter<BeatmapOnlineStatus, Integer> {
    
    @Override
    public Integer convertToDatabaseColumn(BeatmapOnlineStatus status) {
        return status == null ? null : status.getValue();
    }
    
    @Override
    public BeatmapOnlineStatus convertToEntityAttribute(Integer value) {
        return value == null ? null : BeatmapOnlineStatus.fromValue(value);
    }
}
