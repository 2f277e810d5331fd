package com.delivery.console.repl;

import com.delivery.console.common.command.Command;
import com.delivery.console.common.command.CommandType;
import com.delivery.console.common.command.impl.CommandParser;
import com.delivery.console.common.model.CommandResult;
import com.delivery.console.common.service.CommandExecutor;
import com.delivery.console.common.util.ConsoleOutput;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

@Slf4j
public class ReplRunner {

    private final CommandParser parser;
    private final CommandExecutor executor;

    public ReplRunner(CommandParser parser, CommandExecutor executor) {
        this.parser = parser;
        this.executor = executor;
    }

    public void run() {
        run(System.in);
    }

    void run(InputStream in) {
        ConsoleOutput.printlnGreen("Delivery Console REPL. Type 'help' for commands, 'exit' to quit.");
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            while (true) {
                ConsoleOutput.printGreen("> ");
                String line = reader.readLine();
                if (line == null) {
                    break;
                }
                Command command = parser.parse(line);
                if (command.type() == CommandType.EXIT) {
                    ConsoleOutput.printlnGreen("Bye.");
                    break;
                }
                CommandResult result = executor.execute(command);
                if (result != null && result.message != null && !result.message.isEmpty()) {
                    if (result.success) {
                        ConsoleOutput.printlnGreen(result.message);
                    } else {
                        ConsoleOutput.printlnRed(result.message);
                    }
                }
            }
        } catch (IOException e) {
            LOG.error("REPL failed: {}", e.getMessage());
            System.err.println("REPL failed: " + e.getMessage());
        }
    }
}
