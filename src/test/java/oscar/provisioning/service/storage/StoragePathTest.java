package oscar.provisioning.service.storage;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StoragePathTest {

    @Test
    @DisplayName("Should trim spaces and slashes and split bucket from folder")
    void shouldTrimAndSplit() {
        StoragePath path = StoragePath.parse("  /mybucket/sub/dir/ ");

        assertThat(path.bucket()).isEqualTo("mybucket");
        assertThat(path.folder()).isEqualTo("sub/dir");
        assertThat(path.folderKey()).isEqualTo("sub/dir/");
        assertThat(path.fullPath()).isEqualTo("mybucket/sub/dir");
    }

    @Test
    @DisplayName("Should treat a bare bucket as having no folder")
    void shouldHandleBareBucket() {
        StoragePath path = StoragePath.parse("out-bucket/");

        assertThat(path.bucket()).isEqualTo("out-bucket");
        assertThat(path.hasFolder()).isFalse();
        assertThat(path.folderKey()).isNull();
        assertThat(path.fullPath()).isEqualTo("out-bucket");
    }

    @Test
    @DisplayName("Should yield an empty bucket for a null path")
    void shouldHandleNull() {
        assertThat(StoragePath.parse(null).bucket()).isEmpty();
    }
}
