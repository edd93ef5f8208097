package com.scorestats.platform.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceBlacklistEntryId implements Serializable {
    private int beatmapId;
    private int mode;
}
