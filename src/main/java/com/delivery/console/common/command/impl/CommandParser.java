package com.delivery.console.common.command.impl;

import com.delivery.console.common.command.Command;
import com.delivery.console.common.command.CommandType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class CommandParser {
    private static final Pattern TOKEN = Pattern.compile("([^\\s=\"]+=)?\"([^\"]*)\"|\\S+");
    private static final List<String> SEARCH_REQUIRED = List.of("city_from", "city_to", "weight", "width", "height", "length");

    public Command parse(String line) {
        if (line == null) {
            return new InvalidCommand("", "Empty command");
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return new InvalidCommand(line, "Empty command");
        }
        String[] head = trimmed.split("\\s+", 2);
        String cmd = head[0].toLowerCase();
        String rest = head.length > 1 ? head[1].trim() : "";

        return switch (cmd) {
            case "sender" -> new MethodCommand(trimmed, CommandType.SENDER, "getSenderInfo", null, Map.of());
            case "warehouse" -> parseWithId(trimmed, rest, CommandType.WAREHOUSE, "getWarehouseInfo", "warehouse <id>");
            case "requisite" -> parseWithId(trimmed, rest, CommandType.REQUISITE, "getRequisiteInfo", "requisite <id>");
            case "autocomplete" -> parseKeyed(trimmed, rest, CommandType.AUTOCOMPLETE, "autocomplete", List.of("term"),
                    "autocomplete term=<text> [type=address|locality|street|house] [locality_name=..] [geo_id=..] [street=..]");
            case "index" -> parseKeyed(trimmed, rest, CommandType.INDEX, "getIndex", List.of("address"),
                    "index address=\"<address>\"");
            case "search" -> parseKeyed(trimmed, rest, CommandType.SEARCH, "searchDeliveryList", SEARCH_REQUIRED,
                    "search city_from=.. city_to=.. weight=.. width=.. height=.. length=.. [optional=..]");
            case "order" -> rest.isEmpty()
                    ? new InvalidCommand(trimmed, "Syntax: order <json>")
                    : new OrderCommand(trimmed, rest);
            case "call" -> parseCall(trimmed, rest);
            case "help", "?" -> new HelpCommand(trimmed);
            case "exit", "quit" -> new ExitCommand(trimmed);
            default -> new InvalidCommand(trimmed, "Unknown command: " + head[0]);
        };
    }

    private Command parseWithId(String raw, String rest, CommandType type, String method, String syntax) {
        List<String> tokens = tokenize(rest);
        if (tokens.size() != 1 || tokens.get(0).contains("=")) {
            return new InvalidCommand(raw, "Syntax: " + syntax);
        }
        return new MethodCommand(raw, type, method, tokens.get(0), Map.of());
    }

    private Command parseKeyed(String raw, String rest, CommandType type, String method, List<String> required, String syntax) {
        Map<String, String> args = new LinkedHashMap<>();
        for (String token : tokenize(rest)) {
            int eq = token.indexOf('=');
            if (eq <= 0) {
                return new InvalidCommand(raw, "Syntax: " + syntax);
            }
            args.put(token.substring(0, eq), token.substring(eq + 1));
        }
        for (String key : required) {
            if (!args.containsKey(key) || args.get(key).isBlank()) {
                return new InvalidCommand(raw, "Missing " + key + ". Syntax: " + syntax);
            }
        }
        return new MethodCommand(raw, type, method, null, args);
    }

    private Command parseCall(String raw, String rest) {
        String[] parts = rest.split("\\s+", 2);
        if (parts[0].isEmpty() || parts[0].contains("=")) {
            return new InvalidCommand(raw, "Syntax: call <method> [key=value ...]");
        }
        return parseKeyed(raw, parts.length > 1 ? parts[1] : "", CommandType.CALL, parts[0], List.of(),
                "call <method> [key=value ...]");
    }

    List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            if (matcher.group(2) != null) {
                String key = matcher.group(1) == null ? "" : matcher.group(1);
                tokens.add(key + matcher.group(2));
            } else {
                tokens.add(matcher.group());
            }
        }
        return tokens;
    }
}
