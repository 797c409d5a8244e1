package oscar.provisioning.service.storage;

import java.util.Locale;
import java.util.Optional;
import oscar.provisioning.dto.service.StorageProviders;

/**
 * A binding's {@code provider} field split into kind and id. The id defaults to
 * {@value StorageProviders#DEFAULT_PROVIDER} when absent; the kind is lowercased.
 */
public record ProviderReference(String kindName, String id) {

    public static final String SEPARATOR = ".";

    public static ProviderReference parse(String reference) {
        String trimmed = reference == null ? "" : reference.trim();
        int separator = trimmed.indexOf(SEPARATOR);
        if (separator < 0) {
            return new ProviderReference(trimmed.toLowerCase(Locale.ROOT), StorageProviders.DEFAULT_PROVIDER);
        }
        return new ProviderReference(
            trimmed.substring(0, separator).toLowerCase(Locale.ROOT),
            trimmed.substring(separator + SEPARATOR.length()));
    }

    public Optional<ProviderKind> kind() {
        return ProviderKind.fromWireName(kindName);
    }

    public boolean isDefault() {
        return StorageProviders.DEFAULT_PROVIDER.equals(id);
    }

    @Override
    public String toString() {
        return kindName + SEPARATOR + id;
    }
}
