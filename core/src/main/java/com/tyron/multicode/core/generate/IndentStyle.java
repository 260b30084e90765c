package com.tyron.multicode.core.generate;

public enum IndentStyle {
    SPACES,
    TABS
}
