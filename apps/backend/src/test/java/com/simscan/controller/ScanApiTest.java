package com.simscan.controller;

import com.simscan.mapper.UserMapper;
import com.simscan.user.CallerResolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class ScanApiTest {

    @Autowired
    private WebTestClient client;
    @Autowired
    private UserMapper userMapper;

    private long register() {
        String name = "api-" + UUID.randomUUID().toString().substring(0, 8);
        Map<?, ?> body = client.post().uri("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("username", name, "email", name + "@example.com", "password", "password1"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(Map.class)
                .returnResult()
                .getResponseBody();
        assertNotNull(body);
        return ((Number) ((Map<?, ?>) body.get("user")).get("id")).longValue();
    }

    private long adminId() {
        return userMapper.selectByEmail("root-admin@example.com").getId();
    }

    @Test
    void scanWithoutIdentityIsUnauthorized() {
        client.post().uri("/scan")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", "hello", "fileName", "a.txt"))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.reason").isEqualTo("unauthorized");
    }

    @Test
    void scanReturnsMatchesAndRemainingCredits() {
        long userId = register();

        client.post().uri("/scan")
                .header(CallerResolver.USER_HEADER, String.valueOf(userId))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", "api level scan " + UUID.randomUUID(), "fileName", "api.txt"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Document uploaded successfully!")
                .jsonPath("$.creditsLeft").isEqualTo(19)
                .jsonPath("$.matches").isArray();
    }

    @Test
    void emptyTextIsBadRequest() {
        long userId = register();

        client.post().uri("/scan")
                .header(CallerResolver.USER_HEADER, String.valueOf(userId))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", "", "fileName", "a.txt"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.reason").isEqualTo("validation_error");
    }

    @Test
    void duplicateRegistrationIsRejected() {
        String name = "dup-" + UUID.randomUUID().toString().substring(0, 8);
        Map<String, String> body = Map.of("username", name, "email", name + "@example.com", "password", "password1");
        client.post().uri("/auth/register").contentType(MediaType.APPLICATION_JSON).bodyValue(body)
                .exchange().expectStatus().isCreated();

        client.post().uri("/auth/register").contentType(MediaType.APPLICATION_JSON).bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Email or Username already exists!");
    }

    @Test
    void wrongPasswordIsUnauthorized() {
        client.post().uri("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("email", "root-admin@example.com", "password", "not-the-password"))
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void creditRequestFlowThroughAdminEndpoints() {
        long userId = register();

        Map<?, ?> submitted = client.post().uri("/credits/request")
                .header(CallerResolver.USER_HEADER, String.valueOf(userId))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("amount", 5))
                .exchange()
                .expectStatus().isOk()
                .expectBody(Map.class)
                .returnResult()
                .getResponseBody();
        assertNotNull(submitted);
        long requestId = ((Number) submitted.get("requestId")).longValue();

        client.post().uri("/admin/approve-request/{id}", requestId)
                .header(CallerResolver.USER_HEADER, String.valueOf(userId))
                .exchange()
                .expectStatus().isForbidden();

        client.post().uri("/admin/approve-request/{id}", requestId)
                .header(CallerResolver.USER_HEADER, String.valueOf(adminId()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.request.status").isEqualTo("approved");

        client.post().uri("/admin/approve-request/{id}", requestId)
                .header(CallerResolver.USER_HEADER, String.valueOf(adminId()))
                .exchange()
                .expectStatus().isEqualTo(409);

        client.get().uri("/user/profile")
                .header(CallerResolver.USER_HEADER, String.valueOf(userId))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.credits").isEqualTo(25);
    }

    @Test
    void zeroAmountCreditRequestIsBadRequest() {
        long userId = register();

        client.post().uri("/credits/request")
                .header(CallerResolver.USER_HEADER, String.valueOf(userId))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("amount", 0))
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void analyticsIsAdminOnly() {
        long userId = register();

        client.get().uri("/admin/analytics")
                .header(CallerResolver.USER_HEADER, String.valueOf(userId))
                .exchange()
                .expectStatus().isForbidden();

        client.get().uri("/admin/analytics")
                .header(CallerResolver.USER_HEADER, String.valueOf(adminId()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalScans").isNumber()
                .jsonPath("$.mostCommonTopics").isArray();
    }
}
