package io.parley.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.parley.core.integration.remote.RemoteToolInvoker;
import io.parley.core.model.ToolDefinition;
import io.parley.core.session.CredentialProvider;
import io.parley.core.session.Session;
import io.parley.core.session.SessionCredentials;
import io.parley.core.session.SessionRegistry;
import io.parley.core.session.SessionSettings;
import io.parley.core.tool.ToolContext;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RemoteToolTest {

    private final SessionRegistry sessions = new SessionRegistry(SessionSettings.defaults(), CredentialProvider.none());
    private final Map<String, Object> lastArguments = new HashMap<>();
    private final RemoteToolInvoker invoker = new RemoteToolInvoker() {
        @Override
        public List<ToolDefinition> listTools() {
            return List.of();
        }

        @Override
        public String callTool(String name, Map<String, Object> arguments) {
            lastArguments.clear();
            lastArguments.putAll(arguments);
            return "called " + name;
        }
    };

    @AfterEach
    void tearDown() {
        sessions.close();
    }

    @Test
    void shouldInjectSessionCredentials() throws Exception {
        Session session = sessions.getOrCreate("alice");
        session.updateCredentials(new SessionCredentials(Map.of("crm_token", "abc")));
        RemoteTool tool = new RemoteTool(new ToolDefinition("crm.lookup", "Find a customer", null), invoker);

        String result = tool.execute(
            Map.of("id", "42", RemoteTool.CREDENTIALS_ARGUMENT, Map.of("crm_token", "forged")),
            new ToolContext(session)
        );

        assertThat(result).isEqualTo("called crm.lookup");
        assertThat(lastArguments).containsEntry("id", "42");
        assertThat(lastArguments).containsEntry(RemoteTool.CREDENTIALS_ARGUMENT, Map.of("crm_token", "abc"));
    }

    @Test
    void shouldOmitCredentialsWhenSessionHasNone() throws Exception {
        Session session = sessions.getOrCreate("bob");
        RemoteTool tool = new RemoteTool(new ToolDefinition("crm.lookup", null, null), invoker);

        tool.execute(Map.of(RemoteTool.CREDENTIALS_ARGUMENT, "forged"), new ToolContext(session));

        assertThat(lastArguments).doesNotContainKey(RemoteTool.CREDENTIALS_ARGUMENT);
        assertThat(tool.description()).isEqualTo("Tool: crm.lookup");
    }
}
