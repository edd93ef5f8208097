package com.scorestats.platform.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BeatmapPackItemId implements Serializable {
    private int packId;
    private int beatmapsetId;
}
