package io.matrixlabs.planner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Md5MatrixIdentifier Tests")
class Md5MatrixIdentifierTest {

    private final MatrixIdentifier identifier = new Md5MatrixIdentifier();

    private static MatrixMetadata metadata(Map<String, ?> user) {
        return MatrixMetadata.builder()
                .computed(MetadataField.LABEL_NAME, "outcome")
                .computed(MetadataField.MATRIX_TYPE, "train")
                .overlayUser(user)
                .build();
    }

    @Test
    @DisplayName("uuid is a 32 character lowercase hex digest")
    void testUuidFormat() {
        String uuid = identifier.identify(metadata(Collections.emptyMap()));
        assertTrue(uuid.matches("[0-9a-f]{32}"), uuid);
    }

    @Test
    @DisplayName("Nested maps filled in different orders give the same uuid")
    void testKeyOrderIndependent() {
        Map<String, Object> innerA = new LinkedHashMap<>();
        innerA.put("b", 2);
        innerA.put("a", 1);
        Map<String, Object> innerB = new LinkedHashMap<>();
        innerB.put("a", 1);
        innerB.put("b", 2);

        Map<String, Object> userA = new LinkedHashMap<>();
        userA.put("nested", innerA);
        userA.put("experiment", "x");
        Map<String, Object> userB = new LinkedHashMap<>();
        userB.put("experiment", "x");
        userB.put("nested", innerB);

        assertEquals(identifier.identify(metadata(userA)), identifier.identify(metadata(userB)));
    }

    @Test
    @DisplayName("Different content gives different uuids")
    void testDifferentContent() {
        String a = identifier.identify(metadata(Collections.singletonMap("experiment", "x")));
        String b = identifier.identify(metadata(Collections.singletonMap("experiment", "y")));
        assertNotEquals(a, b);
    }

    @Test
    @DisplayName("Dates are written as ISO strings")
    void testDatesAsIsoStrings() {
        String fromDate = identifier.identify(
                metadata(Collections.singletonMap("start", LocalDate.of(2015, 1, 1))));
        String fromString = identifier.identify(
                metadata(Collections.singletonMap("start", "2015-01-01")));
        assertEquals(fromString, fromDate);
        assertEquals("{\"a\":1,\"b\":\"2015-01-01\"}",
                CanonicalJson.write(new java.util.TreeMap<>(Map.of("b", LocalDate.of(2015, 1, 1), "a", 1))));
    }

    @Test
    @DisplayName("Values that cannot be written as JSON are rejected")
    void testUnserializableValue() {
        assertThrows(IllegalArgumentException.class,
                () -> metadata(Collections.singletonMap("bad", new Object())));
    }

    @Test
    @DisplayName("Metadata with the same uuid is equal metadata")
    void testEqualMetadataForEqualUuid() {
        MatrixMetadata fromDate = metadata(Collections.singletonMap("start", LocalDate.of(2015, 1, 1)));
        MatrixMetadata fromString = metadata(Collections.singletonMap("start", "2015-01-01"));
        assertEquals(identifier.identify(fromString), identifier.identify(fromDate));
        assertEquals(fromString, fromDate);
        assertEquals(fromString.hashCode(), fromDate.hashCode());
        assertEquals("2015-01-01", fromDate.get("start"));

        MatrixMetadata fromLong = metadata(Collections.singletonMap("count", 3L));
        MatrixMetadata fromInt = metadata(Collections.singletonMap("count", 3));
        assertEquals(identifier.identify(fromInt), identifier.identify(fromLong));
        assertEquals(fromInt, fromLong);
    }
}
