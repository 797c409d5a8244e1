package oscar.provisioning.controller.health;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import oscar.provisioning.config.OscarProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final OscarProperties properties;

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthStatus = new HashMap<>();
        healthStatus.put("status", "UP");
        healthStatus.put("timestamp", Instant.now().toString());
        healthStatus.put("service", properties.getName());
        healthStatus.put("oidc_enabled", properties.getOidc().isEnabled());
        healthStatus.put("yunikorn_enabled", properties.getYunikorn().isEnabled());
        healthStatus.put("minio_endpoint", properties.getMinio().getEndpoint());
        return ResponseEntity.ok(healthStatus);
    }
}
