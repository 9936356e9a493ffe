package blackcap.coordinator.server;

import blackcap.coordinator.api.Controller;
import blackcap.coordinator.api.Controller.ControllerResponse;
import blackcap.coordinator.error.BlackcapException;
import blackcap.coordinator.error.ErrorKind;
import blackcap.coordinator.schema.ItemResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only /api/v1/* endpoints are served; everything else is 404.
 * Domain exceptions thrown by controllers are mapped to statuses by their {@link ErrorKind}.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body(), response.headers());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}", Map.of());

        } catch (BlackcapException | IllegalArgumentException e) {
            ErrorKind kind = BlackcapException.kindOf(e);
            if (kind == ErrorKind.UNAUTHORIZED || kind == ErrorKind.VALIDATION) {
                log.info("{} {} rejected ({}): {}", method, path, kind, e.getMessage());
            } else {
                log.warn("{} {} failed ({}): {}", method, path, kind, e.getMessage());
            }
            writeSafe(ctx, statusFor(kind), "application/json", errorBody(kind, e.getMessage()), Map.of());
        } catch (Throwable t) {
            log.error("Handler error: {} {} - Exception: {}", method, path, t.toString(), t);
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    errorBody(ErrorKind.INTERNAL, "internal error"), Map.of());
        }
    }

    /**
     * HTTP status for an error kind.
     */
    public static HttpResponseStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> BAD_REQUEST;
            case NOT_FOUND -> NOT_FOUND;
            case CONFLICT -> CONFLICT;
            case TRANSIENT_BACKEND -> SERVICE_UNAVAILABLE;
            case PERMANENT_BACKEND -> BAD_GATEWAY;
            case UNAUTHORIZED -> UNAUTHORIZED;
            case INTERNAL -> INTERNAL_SERVER_ERROR;
        };
    }

    private static String errorBody(ErrorKind kind, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("error", message == null ? "" : message);
        body.put("kind", kind.name());
        return body.toString();
    }

    /**
     * Per-item batch answer: 200 when every item succeeded, 207 otherwise.
     */
    public static ControllerResponse batch(List<? extends ItemResult<?>> results) {
        HttpResponseStatus status = ItemResult.allSucceeded(results) ? OK : MULTI_STATUS;
        return ControllerResponse.json(status, writeJson(Map.of("results", results)));
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body,
            Map<String, String> headers) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            headers.forEach((name, value) -> response.headers().add(name, value));
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            try {
                byte[] errorBytes = "{\"error\":\"failed to write response\"}".getBytes(StandardCharsets.UTF_8);
                FullHttpResponse errorResponse = new DefaultFullHttpResponse(HTTP_1_1, INTERNAL_SERVER_ERROR,
                        Unpooled.wrappedBuffer(errorBytes));
                errorResponse.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
                errorResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, errorBytes.length);
                ctx.writeAndFlush(errorResponse);
            } catch (Throwable t2) {
                log.error("Complete failure writing error response", t2);
                ctx.close();
            }
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    errorBody(ErrorKind.INTERNAL, "channel error"), Map.of());
        } finally {
            ctx.close();
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Decode the request body.
     *
     * @throws IllegalArgumentException for an empty or malformed body
     */
    public static <T> T readJson(FullHttpRequest req, TypeReference<T> type) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        try {
            T value = MAPPER.readValue(body, type);
            if (value == null) {
                throw new IllegalArgumentException("request body is required");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed JSON body: " + e.getOriginalMessage(), e);
        }
    }

    public static String writeJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }
}
