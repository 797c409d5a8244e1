package oscar.provisioning.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class BearerTokensTest {

    @Test
    void shouldExtractBearerToken() {
        assertEquals("abc.def.ghi", BearerTokens.extract("Bearer abc.def.ghi"));
    }

    @Test
    void shouldIgnoreBasicCredentials() {
        assertFalse(BearerTokens.isBearer("Basic b3NjYXI6cGFzcw=="));
        assertNull(BearerTokens.extract("Basic b3NjYXI6cGFzcw=="));
    }

    @Test
    void shouldReturnNullForEmptyBearer() {
        assertNull(BearerTokens.extract("Bearer   "));
        assertNull(BearerTokens.extract(null));
    }
}
