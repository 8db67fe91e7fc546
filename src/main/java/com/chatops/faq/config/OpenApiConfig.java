package com.chatops.faq.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI faqReviewOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("FAQ Review API")
                        .version("1.0.0")
                        .description(
                                "FAQ matching and human review pipeline for chat messages.\n\n" +
                                "**Message Pipeline:**\n" +
                                "1. Receive a chat message via `POST /messages`\n" +
                                "2. Rank it against the FAQ corpus with BM25\n" +
                                "3. **ALPHA** (score >= threshold): answer directly from the corpus\n" +
                                "4. **BETA**: ask the answer generator, then route the proposed answer to a reviewer (round robin)\n" +
                                "5. **UNRELATED** (shorter than the minimum length): drop\n\n" +
                                "**Review Lifecycle:**\n" +
                                "- `PENDING` -> `APPROVED` | `REJECTED` | `EDITING` | `EXPIRED`\n" +
                                "- `EDITING` -> `APPROVED` (submit-edit) | `PENDING` (cancel-edit)\n" +
                                "- Approved answers are posted to the source room with the `🤖 FAQ Bot:` prefix")
                        .contact(new Contact().name("FAQ Bot Team")));
    }
}
