package com.chatops.faq.config;

import com.chatops.faq.engine.MessageClassifier;
import com.chatops.faq.service.CorpusLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClassifierConfig {

    @Bean
    public MessageClassifier messageClassifier(FaqBotConfig config, CorpusLoader corpusLoader) {
        FaqBotConfig.Classifier tuning = config.getClassifier();
        return new MessageClassifier(
                corpusLoader.load(config.getCorpusLocation()),
                config.getSimilarityThreshold(),
                tuning.getMinSimilarityThreshold(),
                tuning.getMinMessageLength(),
                tuning.isQuestionFilterEnabled(),
                tuning.getK1(),
                tuning.getB());
    }
}
