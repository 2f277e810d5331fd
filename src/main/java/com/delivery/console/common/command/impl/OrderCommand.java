package com.delivery.console.common.command.impl;

import com.delivery.console.common.command.Command;
import com.delivery.console.common.command.CommandType;

public class OrderCommand implements Command {
    public final String orderJson;
    private final String raw;

    public OrderCommand(String raw, String orderJson) {
        this.raw = raw;
        this.orderJson = orderJson;
    }

    @Override
    public CommandType type() {
        return CommandType.ORDER;
    }

    @Override
    public String raw() {
        return raw;
    }
}
