package com.medcore.config;

import com.medcore.knowledge.InteractionKnowledgeBase;
import com.medcore.knowledge.KnowledgeBaseLoader;
import com.medcore.knowledge.KnowledgeSnapshotHolder;
import com.medcore.rules.GuidelineRuleRegistry;
import com.medcore.rules.GuidelineRules;
import com.medcore.terminology.TerminologyIndex;
import com.medcore.terminology.TerminologyMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Set;

/**
 * CDSS knowledge wiring
 *
 * Loads the terminology index and interaction tables from
 * {@code cdss.knowledge-base.location} and builds the guideline rule registry,
 * switching off any ids listed in {@code cdss.rules.disabled-ids}.
 */
@Configuration
@Slf4j
public class CdssConfig {

    @Value("${cdss.knowledge-base.location:classpath:knowledge/}")
    private String knowledgeBaseLocation;

    @Value("${cdss.rules.disabled-ids:}")
    private String disabledRuleIds;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TerminologyIndex terminologyIndex(KnowledgeBaseLoader loader) {
        return loader.loadTerminology(knowledgeBaseLocation);
    }

    @Bean
    public TerminologyMatcher terminologyMatcher(TerminologyIndex terminologyIndex) {
        return new TerminologyMatcher(terminologyIndex);
    }

    @Bean
    public KnowledgeSnapshotHolder<InteractionKnowledgeBase> interactionKnowledgeBase(KnowledgeBaseLoader loader) {
        return new KnowledgeSnapshotHolder<>("interaction knowledge base", loader.loadInteractions(knowledgeBaseLocation));
    }

    @Bean
    public KnowledgeSnapshotHolder<GuidelineRuleRegistry> guidelineRuleRegistry() {
        Set<String> disabled = StringUtils.commaDelimitedListToSet(disabledRuleIds.replace(" ", ""));
        disabled.remove("");
        GuidelineRuleRegistry registry = GuidelineRules.defaultRegistry().withDisabled(disabled);
        log.info("Guideline rule registry ready: {} rules, {} active, disabled: {}",
            registry.size(), registry.getActiveRulesCount().getTotal(), disabled);
        return new KnowledgeSnapshotHolder<>("guideline rule registry", registry);
    }
}
