package dustin.escrow.config;

import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityScheme;

/**
 * Swagger 설정
 * OpenAPI Configuration
 *
 * 컨트롤러의 @SecurityRequirement(name = "BearerAuth")가 참조하는 인증 방식 등록
 */
@Configuration
@OpenAPIDefinition(info = @Info(title = "Escrow Swap Service API", version = "v1",
        description = "hashlock/timelock 기반 에스크로 스왑 정산 API"))
@SecurityScheme(name = "BearerAuth", type = SecuritySchemeType.HTTP, scheme = "bearer", bearerFormat = "JWT")
public class OpenApiConfig {
}
