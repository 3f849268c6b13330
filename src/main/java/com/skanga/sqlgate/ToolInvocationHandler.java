package com.skanga.sqlgate;

import com.skanga.sqlgate.config.ResourceManager;
import com.skanga.sqlgate.config.ResourceManager.Titles;
import com.skanga.sqlgate.context.ExecutionContext;
import com.skanga.sqlgate.context.OutputChannel;
import com.skanga.sqlgate.context.OutputMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Request entry point for tool functions. Resets the context, attributes it to the caller,
 * runs the tool and turns the context's output channel and audit buffer into the response.
 * A tool that throws is reported on the output channel and answered with status 500.
 */
public class ToolInvocationHandler {
    private static final Logger logger = LoggerFactory.getLogger(ToolInvocationHandler.class);

    /**
     * A tool body. Tools report what they did through the context's output channel.
     */
    @FunctionalInterface
    public interface Tool {
        void run(ExecutionContext context, SqlGateway gateway) throws Exception;
    }

    private final SqlGateway gateway;

    public ToolInvocationHandler(SqlGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Runs a tool in a fresh context that is closed afterwards.
     */
    public ToolResponse invoke(String toolName, String user, Tool tool) {
        try (ExecutionContext context = gateway.openContext(user)) {
            return invoke(toolName, user, tool, context);
        }
    }

    /**
     * Runs a tool in a context owned by the caller, e.g. one reused across requests on a pooled worker.
     */
    public ToolResponse invoke(String toolName, String user, Tool tool, ExecutionContext context) {
        context.output().clear();
        context.clearLogs();
        context.setCurrentUser(user);

        int statusCode = ToolResponse.OK;
        try {
            tool.run(context, gateway);
        } catch (Exception e) {
            logger.error("Error executing tool {}", toolName, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            context.output().showError(message, ResourceManager.getMessage(Titles.TOOL_ERROR, toolName));
            statusCode = ToolResponse.INTERNAL_ERROR;
        }

        OutputChannel output = context.output();
        List<Map<String, Object>> messages = output.messages().stream()
                .map(OutputMessage::toMap)
                .collect(Collectors.toList());
        return new ToolResponse(statusCode, output.status(), messages, output.error(),
                gateway.executionLogger().getThreadLogs(context));
    }
}
