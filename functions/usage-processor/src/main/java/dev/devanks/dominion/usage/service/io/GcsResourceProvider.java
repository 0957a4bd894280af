package dev.devanks.dominion.usage.service.io;

import com.google.cloud.spring.storage.GoogleStorageResource;
import com.google.cloud.storage.Storage;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.WritableResource;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GcsResourceProvider {

    private static final String GCS_SCHEME = "gs://";

    private final Storage gcsClient;

    public WritableResource createWritableResource(String gcsPath) {
        return new GoogleStorageResource(gcsClient, gcsPath);
    }

    /**
     * Resolves the export location. Anything that is not a {@code gs://} URI is treated as a local file,
     * which is how the function is run outside GCP.
     */
    public Resource createReadableResource(String location) {
        if (location.startsWith(GCS_SCHEME)) {
            return new GoogleStorageResource(gcsClient, location, false);
        }
        return new FileSystemResource(location);
    }
}
