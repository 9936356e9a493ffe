package blackcap.coordinator.schema;

import blackcap.coordinator.error.ErrorKind;
import blackcap.coordinator.error.NotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ItemResultTest {

    @Test
    void itemResultsCarryKindAndIndex() {
        ItemResult<String> ok = ItemResult.success(0, "sch-1");
        ItemResult<String> failed = ItemResult.failure(1, new NotFoundException("gone"));

        assertTrue(ok.isSuccess());
        assertEquals(ErrorKind.NOT_FOUND, failed.errorKind());
        assertEquals("gone", failed.error());
        assertEquals(5, failed.atIndex(5).index());
        assertEquals(Integer.valueOf(5), ok.map(String::length).value());
        assertNull(failed.map(String::length).value());
        assertFalse(ItemResult.allSucceeded(List.of(ok, failed)));
        assertEquals(ErrorKind.INTERNAL, ItemResult.failure(2, new IllegalStateException("x")).errorKind());
    }
}
