package tech.andrefsramos.biz_radar.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "BizRadar - Monitoramento de estabelecimentos próximos",
                version = "v1",
                description = """
                                ---

                                ## 🎯 Visão Geral

                                O **BizRadar** varre periodicamente um diretório de lugares ao redor de uma localização
                                configurada, compara o resultado com a varredura anterior e gera notificações quando:
                                - um estabelecimento novo aparece na área;
                                - a nota de um estabelecimento muda além do limiar configurado;
                                - um estabelecimento mostra atividade crescente (tendência);
                                - um estabelecimento deixa de aparecer por varreduras consecutivas.

                                Falhas e varreduras parciais também viram notificações de sistema.

                                ---

                                ## 🔐 Autenticação

                                - `GET /api/v1/**`: público.
                                - Demais métodos (disparar/cancelar varredura, marcar concorrente, ações em notificações,
                                  alterar configuração): **HTTP Basic** com as credenciais do operador.

                                ---

                                ### 📌 Tratamento de erros resumido
                                | **Código** | **Significado** |
                                |--------|-------------|
                                | **200/204** | Sucesso |
                                | **400** | Parâmetros ou configuração inválidos |
                                | **401** | Credenciais ausentes ou incorretas |
                                | **404** | ID desconhecido |
                                | **409** | Varredura já em andamento |

                                ---

                                ## 🧩Endpoints

                                """
        )
)
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .components(new Components()
                        .addSecuritySchemes("basicAuth",
                                new SecurityScheme()
                                        .name("basicAuth")
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("basic")
                        )
                );
    }
}
