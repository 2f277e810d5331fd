package com.delivery.console.common.service;

import com.delivery.console.client.AutocompleteType;
import com.delivery.console.client.DeliveryClient;
import com.delivery.console.client.DeliverySearch;
import com.delivery.console.common.command.impl.CommandParser;
import com.delivery.console.common.model.CommandResult;
import com.delivery.console.common.model.ProtocolException;
import com.delivery.console.common.param.ParamValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommandExecutorTest {

    @Mock
    private DeliveryClient client;

    private final CommandParser parser = new CommandParser();
    private CommandExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new CommandExecutor(client, new ObjectMapper());
    }

    @Test
    void senderPrintsResponse() {
        ObjectNode response = JsonNodeFactory.instance.objectNode().put("status", "ok");
        when(client.getSenderInfo()).thenReturn(response);

        CommandResult result = executor.execute(parser.parse("sender"));

        assertThat(result.success).isTrue();
        assertThat(result.response).isEqualTo(response);
        assertThat(result.message).startsWith("getSenderInfo OK").contains("\"status\" : \"ok\"");
    }

    @Test
    void protocolErrorIsReportedAsFailure() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("status", "error").put("error", "E1");
        when(client.getWarehouseInfo("9")).thenThrow(new ProtocolException("getWarehouseInfo", "E1", payload));

        CommandResult result = executor.execute(parser.parse("warehouse 9"));

        assertThat(result.success).isFalse();
        assertThat(result.message).startsWith("FAILED:").contains("E1");
    }

    @Test
    void autocompletePassesParsedType() {
        when(client.autocomplete(any(), any(), any(), any(), any())).thenReturn(JsonNodeFactory.instance.objectNode());

        executor.execute(parser.parse("autocomplete term=Тверская type=street locality_name=Москва"));

        verify(client).autocomplete(eq("Тверская"), eq(AutocompleteType.STREET), eq("Москва"), isNull(), isNull());
    }

    @Test
    void searchConvertsNumbers() {
        when(client.searchDeliveryList(any())).thenReturn(JsonNodeFactory.instance.objectNode());
        ArgumentCaptor<DeliverySearch> search = ArgumentCaptor.forClass(DeliverySearch.class);

        executor.execute(parser.parse("search city_from=Москва city_to=Казань weight=1.5 width=10 height=20 length=30"));

        verify(client).searchDeliveryList(search.capture());
        assertThat(search.getValue().weight()).isEqualByComparingTo(new BigDecimal("1.5"));
        assertThat(search.getValue().length()).isEqualTo(30);
        assertThat(search.getValue().totalCost()).isNull();
    }

    @Test
    void badNumberFailsWithoutCallingApi() {
        CommandResult result = executor.execute(parser.parse("search city_from=A city_to=B weight=heavy width=1 height=1 length=1"));

        assertThat(result.success).isFalse();
        assertThat(result.message).contains("weight must be a number");
        verifyNoInteractions(client);
    }

    @Test
    void orderJsonBecomesNestedParams() {
        when(client.createOrder(any())).thenReturn(JsonNodeFactory.instance.objectNode());
        ArgumentCaptor<ParamValue.Mapping> order = ArgumentCaptor.forClass(ParamValue.Mapping.class);

        executor.execute(parser.parse("order {\"order_num\":\"A-1\",\"recipient\":{\"first_name\":\"Ivan\"}}"));

        verify(client).createOrder(order.capture());
        assertThat(order.getValue().get("recipient")).isInstanceOf(ParamValue.Mapping.class);
    }

    @Test
    void orderMustBeJsonObject() {
        CommandResult result = executor.execute(parser.parse("order [1,2]"));

        assertThat(result.success).isFalse();
        verifyNoInteractions(client);
    }

    @Test
    void callForwardsArguments() {
        when(client.request(eq("getPaymentMethods"), any())).thenReturn(JsonNodeFactory.instance.objectNode());
        ArgumentCaptor<ParamValue.Mapping> params = ArgumentCaptor.forClass(ParamValue.Mapping.class);

        executor.execute(parser.parse("call getPaymentMethods order_id=5"));

        verify(client).request(eq("getPaymentMethods"), params.capture());
        assertThat(params.getValue().get("order_id")).isEqualTo(ParamValue.of("5"));
    }

    @Test
    void helpListsCommands() {
        CommandResult result = executor.execute(parser.parse("help"));

        assertThat(result.success).isTrue();
        assertThat(result.message).contains("autocomplete", "search", "order <json>");
    }
}
