package com.github.dimitryivaniuta.dbgateway.runtime;

import com.github.dimitryivaniuta.dbgateway.runtime.RuntimeConfigService.RuntimeConfigOverrides;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Runtime configuration admin API. Transport authentication is the deployment's concern
 * (reverse proxy or Spring Security in front of {@code /api/admin/**}).
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/runtime-config")
public class RuntimeConfigAdminController {

    private final RuntimeConfigService service;

    @GetMapping
    public RuntimeConfig current() {
        return service.current();
    }

    /**
     * Without a body (or with an empty one) the configuration is re-read from its sources;
     * otherwise the given fields are applied on top of the active snapshot.
     * A rejected candidate answers 422 and leaves the active snapshot in force.
     */
    @PostMapping("/reload")
    public ResponseEntity<ReloadResult> reload(@RequestBody(required = false) RuntimeConfigOverrides overrides,
                                               HttpServletRequest request) {
        ReloadTrigger trigger = ReloadTrigger.httpEndpoint(request.getRemoteAddr());
        ReloadResult result = (overrides == null || overrides.isEmpty())
                ? service.reloadFromEnvironment(trigger)
                : service.reloadWithOverrides(overrides, trigger);

        return result.success()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
    }
}
