package uk.gegc.linguapractice.features.answer.domain.model;

public enum DeviceType {
    MOBILE,
    DESKTOP,
    TABLET
}
