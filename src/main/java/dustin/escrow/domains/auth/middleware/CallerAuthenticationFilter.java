package dustin.escrow.domains.auth.middleware;

import java.io.IOException;

import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import dustin.escrow.domains.auth.service.JwtService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 호출자 인증 필터
 * Caller Authentication Filter
 *
 * Bearer JWT의 subject를 호출자 식별자로 request attribute "callerId"에 저장합니다.
 * GET 조회와 Swagger 문서는 인증 없이 통과합니다.
 */
@Component
@RequiredArgsConstructor
public class CallerAuthenticationFilter extends OncePerRequestFilter {

    public static final String CALLER_ATTRIBUTE = "callerId";

    private final JwtService jwtService;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String path = request.getRequestURI();

        if (path.startsWith("/swagger-ui") ||
            path.startsWith("/api-docs") ||
            path.startsWith("/v3/api-docs") ||
            path.startsWith("/swagger-resources") ||
            path.startsWith("/webjars") ||
            "GET".equalsIgnoreCase(request.getMethod())) {
            filterChain.doFilter(request, response);
            return;
        }

        String authHeader = request.getHeader("Authorization");
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            writeError(response, "Missing or invalid authorization header");
            return;
        }

        String token = authHeader.substring(7);
        String callerId;
        try {
            callerId = jwtService.verifyCallerToken(token);
        } catch (RuntimeException e) {
            writeError(response, "Invalid or expired token");
            return;
        }

        request.setAttribute(CALLER_ATTRIBUTE, callerId);
        filterChain.doFilter(request, response);
    }

    private void writeError(HttpServletResponse response, String message) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json; charset=UTF-8");
        response.getWriter().write("{\"error\":\"" + message + "\"}");
        response.getWriter().flush();
    }
}
