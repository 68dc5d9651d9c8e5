package com.questrail.tikz.model;

public enum ConnectorStyle {
    PLAIN,
    DASHED
}
