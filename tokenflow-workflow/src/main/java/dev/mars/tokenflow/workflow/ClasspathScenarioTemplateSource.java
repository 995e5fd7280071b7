/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.tokenflow.workflow;

import dev.mars.tokenflow.workflow.model.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Loads templates from {@code templates/<id>.json} on the classpath.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public class ClasspathScenarioTemplateSource implements ScenarioTemplateSource {

    private static final Logger logger = LoggerFactory.getLogger(ClasspathScenarioTemplateSource.class);
    private static final Pattern TEMPLATE_ID = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9\\-_]*$");

    private final String prefix;
    private final ScenarioParser parser;
    private final ClassLoader classLoader;

    public ClasspathScenarioTemplateSource() {
        this("templates/", new JsonScenarioParser());
    }

    public ClasspathScenarioTemplateSource(String prefix, ScenarioParser parser) {
        this.prefix = prefix.endsWith("/") ? prefix : prefix + "/";
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null");
        this.classLoader = ClasspathScenarioTemplateSource.class.getClassLoader();
    }

    @Override
    public Optional<Scenario> findTemplate(String templateId) throws ScenarioParseException {
        if (templateId == null || !TEMPLATE_ID.matcher(templateId).matches()) {
            logger.warn("Rejected template id {}", templateId);
            return Optional.empty();
        }
        String resource = prefix + templateId + ".json";
        try (InputStream input = classLoader.getResourceAsStream(resource)) {
            if (input == null) {
                return Optional.empty();
            }
            return Optional.of(parser.parse(input, templateId));
        } catch (IOException e) {
            throw new ScenarioParseException(templateId, null, "Failed to read template " + resource, e);
        }
    }
}
