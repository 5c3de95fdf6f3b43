package com.clausescan.processing.model;

public enum ComparisonWinner {
    LEFT,
    RIGHT,
    TIE
}
