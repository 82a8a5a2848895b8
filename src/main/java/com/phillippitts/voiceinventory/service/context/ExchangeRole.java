package com.phillippitts.voiceinventory.service.context;

public enum ExchangeRole {
    USER,
    ASSISTANT
}
