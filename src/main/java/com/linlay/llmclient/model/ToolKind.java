package com.linlay.llmclient.model;

public enum ToolKind {
    FUNCTION,
    FILE_SEARCH,
    WEB_SEARCH,
    COMPUTER_USE,
    CUSTOM
}
