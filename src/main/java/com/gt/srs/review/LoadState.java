package com.gt.srs.review;

public enum LoadState {
    NotLoaded,
    Loading,
    Loaded,
    Failed
}
