package com.designlens.figma;

import com.designlens.core.design.DesignFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link FigmaClient} against a mocked {@link HttpClient}.
 */
class FigmaClientTest {

    private FigmaProperties properties;
    private HttpClient httpClient;
    private HttpResponse<String> response;
    private FigmaClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        properties = new FigmaProperties();
        properties.setApiToken("figd_test_token");
        properties.setBaseUrl("https://api.example.com/v1");
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(response);
        client = new FigmaClient(properties, httpClient);
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        return captor.getValue();
    }

    @Test
    @DisplayName("getFile sends the token header and parses the document")
    void getFile() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
                {"name":"Checkout","document":{"id":"0:0","type":"DOCUMENT","children":[
                  {"id":"1:1","type":"FRAME","name":"Payment Screen"}]}}
                """);

        DesignFile file = client.getFile("AbC123");

        assertEquals("Checkout", file.name());
        assertEquals("1:1", file.document().children().get(0).id());
        HttpRequest request = sentRequest();
        assertEquals("https://api.example.com/v1/files/AbC123", request.uri().toString());
        assertEquals("figd_test_token", request.headers().firstValue("X-Figma-Token").orElseThrow());
    }

    @Test
    @DisplayName("getImages drops nodes the API could not render")
    void getImages() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
                {"err":null,"images":{"1:1":"https://s3.example.com/1.png","1:2":null}}
                """);

        Map<String, String> images = client.getImages("AbC123", List.of("1:1", "1:2"), "jpg", 1.5);

        assertEquals(Map.of("1:1", "https://s3.example.com/1.png"), images);
        assertEquals("https://api.example.com/v1/images/AbC123?ids=1%3A1%2C1%3A2&format=jpg&scale=1.5",
                sentRequest().uri().toString());
    }

    @Test
    @DisplayName("getImages with no ids makes no request")
    void noIds() throws Exception {
        assertTrue(client.getImages("AbC123", List.of()).isEmpty());
        verify(httpClient, never()).send(any(), any());
    }

    @Test
    @DisplayName("Non-2xx responses become FigmaApiException with the status")
    void errorStatus() {
        when(response.statusCode()).thenReturn(403);
        when(response.body()).thenReturn("{\"status\":403,\"err\":\"Invalid token\"}");

        var e = assertThrows(FigmaApiException.class, () -> client.getFile("AbC123"));
        assertEquals(403, e.getStatus());
        assertTrue(e.getMessage().contains("HTTP 403"));
    }

    @Test
    @DisplayName("A missing token fails before any request")
    void missingToken() throws Exception {
        properties.setApiToken("");

        var e = assertThrows(FigmaApiException.class, () -> client.getFile("AbC123"));
        assertEquals(401, e.getStatus());
        verify(httpClient, never()).send(any(), any());
    }

    @Test
    @DisplayName("I/O failures are wrapped")
    void ioFailure() throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenThrow(new IOException("connection reset"));

        var e = assertThrows(FigmaApiException.class, () -> client.getFile("AbC123"));
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals(0, e.getStatus());
    }
}
