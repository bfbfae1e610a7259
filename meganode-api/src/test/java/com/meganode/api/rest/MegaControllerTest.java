package com.meganode.api.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.meganode.core.exception.AdmissionDeniedException;
import com.meganode.core.exception.MisroutedRequestException;
import com.meganode.core.exception.RunnerBusyException;
import com.meganode.core.exception.ShuttingDownException;
import com.meganode.core.exception.UserEvictingException;
import com.meganode.core.exception.UserNodeStoppedException;
import com.meganode.core.model.MegaConfig;
import com.meganode.core.model.MegaId;
import com.meganode.core.model.UserPk;
import com.meganode.engine.MegaNode;
import com.meganode.scheduler.RunnerMetrics;
import com.meganode.worker.UserNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.*;

class MegaControllerTest {

    private static final MegaId MEGA = MegaId.of(11);
    private static final String ALICE = UserPk.fromLong(1).hex();
    private static final String BOB = UserPk.fromLong(2).hex();

    private static final UserNode READY_NODE = ctx -> {
        ctx.markReady(7000, 7001);
        ctx.awaitStop();
    };

    private MegaNode megaNode;
    private MegaController controller;

    @BeforeEach
    void setUp() {
        MegaConfig config = MegaConfig.builder(MEGA)
            .userShutdownTimeout(Duration.ofSeconds(2))
            .strictInvariants(true)
            .build();
        megaNode = new MegaNode(config, READY_NODE, RunnerMetrics.unexported(), null, Clock.systemUTC());
        megaNode.start();
        controller = new MegaController(megaNode);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        megaNode.requestShutdown("test");
        megaNode.awaitTermination();
    }

    private static Object body(ResponseEntity<?> response) {
        return response.getBody();
    }

    private MegaController.StatusResponse awaitStatus(Predicate<MegaController.StatusResponse> condition)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        MegaController.StatusResponse status = controller.status().getBody();
        while (!condition.test(status) && System.nanoTime() < deadline) {
            Thread.sleep(10);
            status = controller.status().getBody();
        }
        return status;
    }

    @Nested
    @DisplayName("POST /mega/run_user")
    class RunUser {

        @Test
        @DisplayName("Responds with the user node's ports once it is ready")
        void ready() throws Exception {
            ResponseEntity<?> response = controller
                .runUser(new MegaController.RunUserBody(ALICE, 5, MEGA.value(), false))
                .get(5, TimeUnit.SECONDS);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(body(response)).isEqualTo(
                new MegaController.RunUserResponseBody(ALICE, 7000, 7001, false));
        }

        @Test
        @DisplayName("Rejects a request meant for another meganode with 409")
        void misrouted() throws Exception {
            ResponseEntity<?> response = controller
                .runUser(new MegaController.RunUserBody(ALICE, 5, MEGA.value() + 1, false))
                .get(5, TimeUnit.SECONDS);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
            assertThat(body(response)).isInstanceOfSatisfying(MegaController.ErrorResponse.class, error -> {
                assertThat(error.errorCode()).isEqualTo(MisroutedRequestException.ERROR_CODE);
                assertThat(error.retryable()).isFalse();
            });
        }

        @Test
        @DisplayName("Accepts lease ids across the full unsigned 32-bit range")
        void unsignedLeaseId() throws Exception {
            long leaseId = 3_000_000_000L;

            ResponseEntity<?> response = controller
                .runUser(new MegaController.RunUserBody(ALICE, leaseId, MEGA.value(), false))
                .get(5, TimeUnit.SECONDS);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            MegaController.StatusResponse status = awaitStatus(s -> s.running() == 1);
            assertThat(status.users()).singleElement()
                .satisfies(user -> assertThat(user.leaseId()).isEqualTo(leaseId));
        }

        @Test
        @DisplayName("Binds an unsigned lease id from snake_case JSON")
        void unsignedLeaseIdFromJson() throws Exception {
            ObjectMapper mapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            String json = "{\"user_pk\":\"" + ALICE + "\",\"lease_id\":3000000000,"
                + "\"mega_id\":" + MEGA.value() + ",\"shutdown_after_sync\":false}";

            MegaController.RunUserBody body = mapper.readValue(json, MegaController.RunUserBody.class);

            assertThat(body.leaseId()).isEqualTo(3_000_000_000L);
            assertThat(body.userPk()).isEqualTo(ALICE);
        }

        @Test
        @DisplayName("Rejects a lease id outside the unsigned 32-bit range with 400")
        void leaseIdOutOfRange() throws Exception {
            ResponseEntity<?> negative = controller
                .runUser(new MegaController.RunUserBody(ALICE, -1, MEGA.value(), false))
                .get(1, TimeUnit.SECONDS);
            ResponseEntity<?> tooLarge = controller
                .runUser(new MegaController.RunUserBody(ALICE, 1L << 32, MEGA.value(), false))
                .get(1, TimeUnit.SECONDS);

            assertThat(negative.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(tooLarge.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(megaNode.status().users()).isEmpty();
        }

        @Test
        @DisplayName("Rejects a malformed user pk with 400")
        void badUserPk() throws Exception {
            ResponseEntity<?> response = controller
                .runUser(new MegaController.RunUserBody("not-hex", 5, MEGA.value(), false))
                .get(1, TimeUnit.SECONDS);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        }

        @Test
        @DisplayName("Rejects with 503 once the meganode is shutting down")
        void shuttingDown() throws Exception {
            megaNode.requestShutdown("test");
            megaNode.awaitTermination();

            ResponseEntity<?> response = controller
                .runUser(new MegaController.RunUserBody(ALICE, 5, MEGA.value(), false))
                .get(5, TimeUnit.SECONDS);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(body(response)).isInstanceOfSatisfying(MegaController.ErrorResponse.class, error ->
                assertThat(error.errorCode()).isEqualTo(ShuttingDownException.ERROR_CODE));
        }
    }

    @Nested
    @DisplayName("POST /mega/evict_user")
    class EvictUser {

        @Test
        @DisplayName("Completes once a running user is gone")
        void evictsRunningUser() throws Exception {
            controller.runUser(new MegaController.RunUserBody(ALICE, 5, MEGA.value(), false))
                .get(5, TimeUnit.SECONDS);

            ResponseEntity<?> response = controller
                .evictUser(new MegaController.EvictUserBody(ALICE, MEGA.value()))
                .get(5, TimeUnit.SECONDS);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(awaitStatus(status -> status.users().isEmpty()).users()).isEmpty();
        }

        @Test
        @DisplayName("Succeeds for a user that is not running here")
        void unknownUser() throws Exception {
            ResponseEntity<?> response = controller
                .evictUser(new MegaController.EvictUserBody(BOB, MEGA.value()))
                .get(5, TimeUnit.SECONDS);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        }
    }

    @Test
    @DisplayName("POST /mega/activity accepts unknown users without effect")
    void activity() {
        ResponseEntity<?> response = controller.activity(new MegaController.ActivityBody(List.of(ALICE, BOB)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(body(response)).isEqualTo(Map.of("accepted", 2));
    }

    @Test
    @DisplayName("POST /mega/activity rejects malformed user pks")
    void activityBadUserPk() {
        ResponseEntity<?> response = controller.activity(new MegaController.ActivityBody(List.of(ALICE, "zz")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    @DisplayName("GET /mega/status lists running users")
    void status() throws Exception {
        controller.runUser(new MegaController.RunUserBody(ALICE, 5, MEGA.value(), false))
            .get(5, TimeUnit.SECONDS);

        MegaController.StatusResponse status = awaitStatus(s -> s.running() == 1);

        assertThat(status.megaId()).isEqualTo(MEGA.value());
        assertThat(status.running()).isEqualTo(1);
        assertThat(status.users()).singleElement().satisfies(user -> {
            assertThat(user.userPk()).isEqualTo(ALICE);
            assertThat(user.leaseId()).isEqualTo(5L);
        });
        assertThat(status.memoryUsed()).isPositive();
        assertThat(status.shutdownRequested()).isFalse();
    }

    @Nested
    @DisplayName("Error mapping")
    class Errors {

        private final UserPk user = UserPk.fromLong(3);

        @Test
        @DisplayName("Unwraps completion exceptions")
        void unwraps() {
            ResponseEntity<MegaController.ErrorResponse> response = MegaController.errorResponse(
                new CompletionException(new UserEvictingException(user)));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(response.getBody().errorCode()).isEqualTo(UserEvictingException.ERROR_CODE);
            assertThat(response.getBody().retryable()).isTrue();
        }

        @Test
        @DisplayName("Admission denial is 503, retryable only when an eviction started")
        void admissionDenied() {
            ResponseEntity<MegaController.ErrorResponse> started =
                MegaController.errorResponse(new AdmissionDeniedException(user, 10, 10, true));
            ResponseEntity<MegaController.ErrorResponse> notStarted =
                MegaController.errorResponse(new AdmissionDeniedException(user, 10, 10, false));

            assertThat(started.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(started.getBody().retryable()).isTrue();
            assertThat(notStarted.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(notStarted.getBody().retryable()).isFalse();
        }

        @Test
        @DisplayName("A busy runner is 503")
        void busy() {
            assertThat(MegaController.errorResponse(new RunnerBusyException(1024)).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        }

        @Test
        @DisplayName("A user node that died before becoming ready is 502")
        void nodeStopped() {
            assertThat(MegaController.errorResponse(new UserNodeStoppedException(user, "exit")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_GATEWAY);
        }

        @Test
        @DisplayName("Anything else is 500")
        void unexpected() {
            ResponseEntity<MegaController.ErrorResponse> response =
                MegaController.errorResponse(new IllegalStateException("boom"));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
            assertThat(response.getBody().errorCode()).isEqualTo("INTERNAL_ERROR");
        }
    }
}
