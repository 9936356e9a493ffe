package blackcap.coordinator.api.v1;

import blackcap.coordinator.api.Controller;
import blackcap.coordinator.api.v1.dto.TokenResponse;
import blackcap.coordinator.auth.Credentials;
import blackcap.coordinator.auth.IdentityProvider;
import blackcap.coordinator.auth.SessionToken;
import blackcap.coordinator.server.RouterHandler;
import com.fasterxml.jackson.core.type.TypeReference;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.cookie.DefaultCookie;
import io.netty.handler.codec.http.cookie.ServerCookieEncoder;

import java.time.Duration;

/**
 * Login endpoint.
 * POST /api/v1/auth/login - exchange {email, apiKey} for a session token
 */
public class AuthController implements Controller {

    private static final String LOGIN_PATH = "/api/v1/auth/login";

    private final IdentityProvider identityProvider;
    private final Duration tokenTtl;

    public AuthController(IdentityProvider identityProvider, Duration tokenTtl) {
        this.identityProvider = identityProvider;
        this.tokenTtl = tokenTtl;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && LOGIN_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Credentials credentials = RouterHandler.readJson(req, new TypeReference<Credentials>() {
        });
        SessionToken token = identityProvider.authenticate(credentials);

        DefaultCookie cookie = new DefaultCookie(SESSION_COOKIE, token.value());
        cookie.setHttpOnly(true);
        cookie.setPath("/api");
        cookie.setMaxAge(tokenTtl.toSeconds());

        return ControllerResponse.json(RouterHandler.writeJson(new TokenResponse(token.value(), tokenTtl.toSeconds())))
                .withHeader(HttpHeaderNames.SET_COOKIE.toString(), ServerCookieEncoder.STRICT.encode(cookie));
    }
}
