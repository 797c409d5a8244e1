package oscar.provisioning.dto.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input or output binding: a provider reference ({@code kind} or {@code kind.id}) and a
 * storage path ({@code bucket[/folder...]}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageIOConfig {

    @NotBlank
    private String provider;

    @NotBlank
    private String path;
}
