package com.delivery.console.common.service;

import com.delivery.console.client.AutocompleteType;
import com.delivery.console.client.DeliveryClient;
import com.delivery.console.client.DeliverySearch;
import com.delivery.console.common.command.Command;
import com.delivery.console.common.command.impl.InvalidCommand;
import com.delivery.console.common.command.impl.MethodCommand;
import com.delivery.console.common.command.impl.OrderCommand;
import com.delivery.console.common.model.CommandResult;
import com.delivery.console.common.model.DeliveryException;
import com.delivery.console.common.model.ParameterValidationException;
import com.delivery.console.common.param.ParamValue;
import com.delivery.console.common.util.LogSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

@Slf4j
public class CommandExecutor {

    private final DeliveryClient client;
    private final ObjectMapper objectMapper;

    public CommandExecutor(DeliveryClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    public CommandResult execute(Command command) {
        String raw = command.raw();
        LOG.info("COMMAND: {}", LogSanitizer.sanitize(raw));
        try {
            return switch (command.type()) {
                case HELP -> CommandResult.success(helpText());
                case INVALID -> CommandResult.failure(((InvalidCommand) command).error);
                case SENDER -> respond("getSenderInfo", client.getSenderInfo());
                case WAREHOUSE -> respond("getWarehouseInfo", client.getWarehouseInfo(((MethodCommand) command).id));
                case REQUISITE -> respond("getRequisiteInfo", client.getRequisiteInfo(((MethodCommand) command).id));
                case AUTOCOMPLETE -> handleAutocomplete((MethodCommand) command);
                case INDEX -> respond("getIndex", client.getIndex(((MethodCommand) command).arg("address")));
                case SEARCH -> handleSearch((MethodCommand) command);
                case ORDER -> handleOrder((OrderCommand) command);
                case CALL -> handleCall((MethodCommand) command);
                default -> CommandResult.failure("Unsupported command");
            };
        } catch (DeliveryException e) {
            logError(e.getUserMessage());
            return CommandResult.failure("FAILED: " + e.getUserMessage());
        } catch (Exception e) {
            logError(e.getMessage());
            return CommandResult.failure("FAILED: " + e.getMessage());
        }
    }

    private static void logError(String e) {
        LOG.error("FAILED: {}", LogSanitizer.sanitize(e));
    }

    private static void logSuccess(String message) {
        LOG.info("SUCCESS: {}", message);
    }

    private CommandResult handleAutocomplete(MethodCommand cmd) {
        JsonNode response = client.autocomplete(cmd.arg("term"), AutocompleteType.from(cmd.arg("type")),
                cmd.arg("locality_name"), cmd.arg("geo_id"), cmd.arg("street"));
        return respond(cmd.method, response);
    }

    private CommandResult handleSearch(MethodCommand cmd) {
        DeliverySearch search = new DeliverySearch(
                cmd.arg("city_from"),
                cmd.arg("city_to"),
                decimal(cmd, "weight"),
                integer(cmd, "width"),
                integer(cmd, "height"),
                integer(cmd, "length"),
                cmd.arg("geo_id_to"),
                cmd.arg("geo_id_from"),
                cmd.arg("delivery_type"),
                decimal(cmd, "total_cost"),
                integer(cmd, "index_city"),
                integer(cmd, "to_yd_warehouse"),
                decimal(cmd, "order_cost"),
                decimal(cmd, "assessed_value"));
        return respond(cmd.method, client.searchDeliveryList(search));
    }

    private CommandResult handleOrder(OrderCommand cmd) {
        JsonNode order;
        try {
            order = objectMapper.readTree(cmd.orderJson);
        } catch (JsonProcessingException e) {
            throw new ParameterValidationException("Order must be a JSON object: " + e.getOriginalMessage());
        }
        if (order == null || !order.isObject()) {
            throw new ParameterValidationException("Order must be a JSON object");
        }
        return respond("createOrder", client.createOrder((ParamValue.Mapping) ParamValue.from(order)));
    }

    private CommandResult handleCall(MethodCommand cmd) {
        return respond(cmd.method, client.request(cmd.method, (ParamValue.Mapping) ParamValue.from(cmd.args)));
    }

    private CommandResult respond(String method, JsonNode response) {
        String message = method + " OK\n" + pretty(response);
        logSuccess(method + " OK");
        return CommandResult.success(message, response);
    }

    private String pretty(JsonNode response) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response);
        } catch (JsonProcessingException e) {
            return String.valueOf(response);
        }
    }

    private static BigDecimal decimal(MethodCommand cmd, String key) {
        String value = cmd.arg(key);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new ParameterValidationException(key + " must be a number: " + value);
        }
    }

    private static Integer integer(MethodCommand cmd, String key) {
        String value = cmd.arg(key);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new ParameterValidationException(key + " must be an integer: " + value);
        }
    }

    private String helpText() {
        return String.join("\n",
                "Commands:",
                "  sender",
                "  warehouse <id>",
                "  requisite <id>",
                "  autocomplete term=<text> [type=address|locality|street|house] [locality_name=..] [geo_id=..] [street=..]",
                "  index address=\"<address>\"",
                "  search city_from=.. city_to=.. weight=.. width=.. height=.. length=.. [geo_id_to=..] [delivery_type=..] ...",
                "  order <json>",
                "  call <method> [key=value ...]",
                "  help",
                "  exit"
        );
    }
}
