package com.tengen.core.model;

public enum GoGameType {
    HUMAN_VS_HUMAN,
    COMPUTER_VS_HUMAN,
    COMPUTER_VS_COMPUTER
}
