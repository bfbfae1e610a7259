package com.meganode.api.rest;

import com.meganode.core.exception.AdmissionDeniedException;
import com.meganode.core.exception.MeganodeException;
import com.meganode.core.exception.MisroutedRequestException;
import com.meganode.core.exception.ShuttingDownException;
import com.meganode.core.exception.UserNodeStoppedException;
import com.meganode.core.model.EvictUserRequest;
import com.meganode.core.model.LeaseId;
import com.meganode.core.model.MegaId;
import com.meganode.core.model.RunUserRequest;
import com.meganode.core.model.UserActivity;
import com.meganode.core.model.UserPk;
import com.meganode.core.model.UserRunResponse;
import com.meganode.core.model.UserState;
import com.meganode.engine.MegaNode;
import com.meganode.scheduler.RunnerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * REST API through which the fleet manager drives this meganode.
 * Each call becomes one command for the user runner.
 */
@RestController
@RequestMapping("/mega")
public class MegaController {

    private static final Logger log = LoggerFactory.getLogger(MegaController.class);

    private final MegaNode megaNode;

    public MegaController(MegaNode megaNode) {
        this.megaNode = megaNode;
    }

    /**
     * Run a user, or renew its lease. Completes once the user node is ready.
     */
    @PostMapping("/run_user")
    public CompletableFuture<ResponseEntity<?>> runUser(@RequestBody RunUserBody request) {
        RunUserRequest command;
        try {
            command = RunUserRequest.of(
                UserPk.fromHex(request.userPk()),
                LeaseId.fromUnsigned(request.leaseId()),
                MegaId.of(request.megaId()),
                request.shutdownAfterSync()
            );
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(badRequest(e));
        }

        megaNode.submit(command);
        return command.readyWaiter().<ResponseEntity<?>>handle((response, error) -> error == null
            ? ResponseEntity.ok(RunUserResponseBody.from(response))
            : errorResponse(error));
    }

    /**
     * Stop a user. Completes once its memory is free.
     */
    @PostMapping("/evict_user")
    public CompletableFuture<ResponseEntity<?>> evictUser(@RequestBody EvictUserBody request) {
        EvictUserRequest command;
        try {
            command = EvictUserRequest.of(UserPk.fromHex(request.userPk()), MegaId.of(request.megaId()));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(badRequest(e));
        }

        megaNode.submit(command);
        return command.stoppedWaiter().<ResponseEntity<?>>handle((ignored, error) -> error == null
            ? ResponseEntity.ok(Map.of())
            : errorResponse(error));
    }

    /**
     * Mark users as active. Unknown users are ignored.
     */
    @PostMapping("/activity")
    public ResponseEntity<?> activity(@RequestBody ActivityBody request) {
        List<UserPk> users;
        try {
            users = request.userPks().stream().map(UserPk::fromHex).toList();
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        }

        int accepted = 0;
        for (UserPk userPk : users) {
            if (megaNode.submit(new UserActivity(userPk))) {
                accepted++;
            }
        }
        return ResponseEntity.ok(Map.of("accepted", accepted));
    }

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> status() {
        return ResponseEntity.ok(StatusResponse.from(megaNode.status()));
    }

    // ========== Errors ==========

    static ResponseEntity<ErrorResponse> errorResponse(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
        if (!(cause instanceof MeganodeException e)) {
            log.error("Unexpected error handling request", cause);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", String.valueOf(cause.getMessage()), false));
        }

        HttpStatus status;
        if (e instanceof MisroutedRequestException) {
            status = HttpStatus.CONFLICT;
        } else if (e.isRetryable() || e instanceof AdmissionDeniedException
                || e instanceof ShuttingDownException) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
        } else if (e instanceof UserNodeStoppedException) {
            status = HttpStatus.BAD_GATEWAY;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage(), e.isRetryable()));
    }

    private static ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage(), false));
    }

    // ========== DTOs ==========

    public record RunUserBody(
        String userPk,
        long leaseId,
        int megaId,
        boolean shutdownAfterSync
    ) {}

    public record EvictUserBody(String userPk, int megaId) {}

    public record ActivityBody(List<String> userPks) {}

    public record RunUserResponseBody(
        String userPk,
        Integer appPort,
        Integer lexePort,
        boolean syncCompleted
    ) {
        public static RunUserResponseBody from(UserRunResponse response) {
            return new RunUserResponseBody(
                response.userPk().hex(),
                response.isReady() ? response.ports().appPort() : null,
                response.isReady() ? response.ports().lexePort() : null,
                response.syncCompleted()
            );
        }
    }

    public record ErrorResponse(String errorCode, String message, boolean retryable) {}

    public record StatusResponse(
        int megaId,
        int starting,
        int running,
        int evicting,
        long memoryUsed,
        long memorySoftLimit,
        long memoryHardLimit,
        Instant lastMegaActivity,
        boolean shutdownRequested,
        List<UserStatusResponse> users
    ) {
        public static StatusResponse from(RunnerStatus status) {
            return new StatusResponse(
                status.megaId().value(),
                status.starting(),
                status.running(),
                status.evicting(),
                status.currentMemory(),
                status.softLimit(),
                status.hardLimit(),
                status.lastMegaActivity(),
                status.shutdownRequested(),
                status.users().stream().map(UserStatusResponse::from).toList()
            );
        }
    }

    public record UserStatusResponse(
        String userPk,
        UserState state,
        long leaseId,
        Instant lastActiveAt,
        Instant leaseExpiresAt
    ) {
        public static UserStatusResponse from(RunnerStatus.UserStatus user) {
            return new UserStatusResponse(
                user.userPk().hex(),
                user.state(),
                user.leaseId().unsignedValue(),
                user.lastActiveAt(),
                user.leaseExpiresAt()
            );
        }
    }
}
