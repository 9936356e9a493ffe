package blackcap.coordinator.schema;

import blackcap.coordinator.error.BlackcapException;
import blackcap.coordinator.error.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.function.Function;

/**
 * Outcome of one item of a batch operation.
 * Exactly one of {@code value} and {@code errorKind} is set.
 *
 * @param index position of the item in the request list
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemResult<T>(
        @JsonProperty("index") int index,
        @JsonProperty("value") T value,
        @JsonProperty("errorKind") ErrorKind errorKind,
        @JsonProperty("error") String error) {

    public static <T> ItemResult<T> success(int index, T value) {
        return new ItemResult<>(index, value, null, null);
    }

    public static <T> ItemResult<T> failure(int index, ErrorKind kind, String message) {
        return new ItemResult<>(index, null, kind, message);
    }

    public static <T> ItemResult<T> failure(int index, Throwable t) {
        return new ItemResult<>(index, null, BlackcapException.kindOf(t), t.getMessage());
    }

    @JsonProperty("ok")
    public boolean isSuccess() {
        return errorKind == null;
    }

    /** Same outcome reported at a different position (used when merging sub-batches). */
    public ItemResult<T> atIndex(int newIndex) {
        return new ItemResult<>(newIndex, value, errorKind, error);
    }

    /** Convert the value of a successful result, keeping failures as they are. */
    public <R> ItemResult<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? new ItemResult<>(index, mapper.apply(value), null, null)
                : new ItemResult<>(index, null, errorKind, error);
    }

    public static boolean allSucceeded(List<? extends ItemResult<?>> results) {
        return results.stream().allMatch(ItemResult::isSuccess);
    }
}
