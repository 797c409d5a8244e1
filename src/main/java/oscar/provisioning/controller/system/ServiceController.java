package oscar.provisioning.controller.system;

import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.dto.service.ServiceDefinition;
import oscar.provisioning.service.provisioning.ProvisioningOrchestrator;
import oscar.provisioning.util.BearerTokens;
import oscar.provisioning.util.LogSanitizer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service management API. Failures are rendered by the global exception handler.
 */
@RestController
@RequestMapping("/system/services")
@RequiredArgsConstructor
@Slf4j
public class ServiceController {

    private final ProvisioningOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<Map<String, Object>> createService(
        @Valid @RequestBody ServiceDefinition service,
        @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        orchestrator.createService(service, BearerTokens.extract(authorization));
        log.info("Service {} created", LogSanitizer.sanitize(service.getName()));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
            "success", true,
            "name", service.getName()
        ));
    }
}
