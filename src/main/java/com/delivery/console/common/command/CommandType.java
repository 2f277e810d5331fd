package com.delivery.console.common.command;

public enum CommandType {
    SENDER,
    WAREHOUSE,
    REQUISITE,
    AUTOCOMPLETE,
    INDEX,
    SEARCH,
    ORDER,
    CALL,
    HELP,
    EXIT,
    INVALID
}
