package com.ledgermatch.domain;

public enum MatchOutcome {
    UNIQUE,
    DUPLICATE
}
