package com.purchasingpower.policyflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.policyflow.client.PromptMessage;
import com.purchasingpower.policyflow.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads stage prompts from YAML files and renders them with Mustache into
 * role-tagged messages.
 *
 * Usage:
 * List&lt;PromptMessage&gt; messages = promptLibrary.render("risk", Map.of(
 *     "profileJson", profileJson
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (Exception e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * Render the system and user parts of a template as separate messages.
     */
    public List<PromptMessage> render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = getTemplate(templateName);

        List<PromptMessage> messages = new ArrayList<>(2);
        if (template.getSystemPrompt() != null && !template.getSystemPrompt().isBlank()) {
            messages.add(PromptMessage.system(renderText(templateName + "#system", template.getSystemPrompt(), variables)));
        }
        messages.add(PromptMessage.user(renderText(templateName + "#user", template.getUserPrompt(), variables)));
        return messages;
    }

    public PromptTemplate getTemplate(String name) {
        PromptTemplate template = templates.get(name);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + name);
        }
        return template;
    }

    private String renderText(String cacheName, String text, Map<String, Object> variables) {
        Mustache mustache = mustacheFactory.compile(new StringReader(text), cacheName);
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }
}
