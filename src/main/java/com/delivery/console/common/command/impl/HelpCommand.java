package com.delivery.console.common.command.impl;

import com.delivery.console.common.command.Command;
import com.delivery.console.common.command.CommandType;

public class HelpCommand implements Command {
    private final String raw;

    public HelpCommand(String raw) {
        this.raw = raw;
    }

    @Override
    public CommandType type() {
        return CommandType.HELP;
    }

    @Override
    public String raw() {
        return raw;
    }
}
