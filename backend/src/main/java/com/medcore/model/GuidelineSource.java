package com.medcore.model;

public enum GuidelineSource {
    KDIGO,  // nephrology
    ESC,
    AHA,
    AAO,    // ophthalmology
    WHO,
    FDA,
    INTERNAL
}
