package com.delivery.console.common.command.impl;

import com.delivery.console.common.command.Command;
import com.delivery.console.common.command.CommandType;

import java.util.Map;

/**
 * An endpoint call with positional id and {@code key=value} arguments, e.g.
 * {@code autocomplete term=Mos type=locality}.
 */
public class MethodCommand implements Command {
    public final String method;
    public final String id;
    public final Map<String, String> args;
    private final CommandType type;
    private final String raw;

    public MethodCommand(String raw, CommandType type, String method, String id, Map<String, String> args) {
        this.raw = raw;
        this.type = type;
        this.method = method;
        this.id = id;
        this.args = Map.copyOf(args);
    }

    public String arg(String key) {
        return args.get(key);
    }

    @Override
    public CommandType type() {
        return type;
    }

    @Override
    public String raw() {
        return raw;
    }
}
