package com.scorestats.platform.model;

public enum ScoreRank {
    F,
    D,
    C,
    B,
    A,
    S,
    SH,
    X,
    XH
}
