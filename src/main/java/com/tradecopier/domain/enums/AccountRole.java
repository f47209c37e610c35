package com.tradecopier.domain.enums;

/**
 * Which side of the copy relationship an account plays. Master activity is observed, slave
 * activity is driven.
 */
public enum AccountRole {
    MASTER,
    SLAVE
}
