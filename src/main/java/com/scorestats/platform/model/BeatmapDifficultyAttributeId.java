package com.scorestats.platform.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BeatmapDifficultyAttributeId implements Serializable {
    private int beatmapId;
    private int mode;
    private int mods;
    private int attribId;
}
