package com.delivery.console.common.command;

public interface Command {
    CommandType type();

    String raw();
}
