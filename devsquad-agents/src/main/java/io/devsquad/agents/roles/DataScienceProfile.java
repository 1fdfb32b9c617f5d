/*
 * Copyright (c) 2025 DevSquad Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.devsquad.agents.roles;

import io.devsquad.agents.AgentProfile;
import io.devsquad.core.capabilities.Capability;
import io.devsquad.core.capabilities.CapabilityRegistry;
import io.devsquad.core.capabilities.CapabilityResult;
import io.devsquad.core.capabilities.InputSchemas;
import io.devsquad.core.capabilities.SuggestionPrompter.Prompt;
import io.devsquad.core.model.AgentIdentity;
import io.devsquad.core.model.AgentRole;
import io.devsquad.core.response.ResponseTopic;

import java.util.Map;

import static io.devsquad.agents.tools.ToolArguments.text;

public class DataScienceProfile implements AgentProfile {
    private static final String DEFAULT_ANALYSIS = "exploratory";

    @Override
    public AgentIdentity identity() {
        return AgentIdentity.builder()
                .id(AgentRole.DATASCIENCE.defaultAgentId())
                .role(AgentRole.DATASCIENCE)
                .displayName("AI Data Scientist")
                .build();
    }

    @Override
    public String roleDescription() {
        return "a data science expert specializing in machine learning, data analysis, visualization, and "
                + "predictive modeling";
    }

    @Override
    public Map<ResponseTopic, String> fallbackAnswers() {
        return Map.of(
                ResponseTopic.AUTH,
                "I'll analyze login patterns to flag anomalous authentication attempts.",
                ResponseTopic.CATALOG,
                "I'll build a recommendation model and search ranking for the product catalog.",
                ResponseTopic.CART,
                "I'll analyze cart abandonment and model conversion drivers.",
                ResponseTopic.DEFAULT,
                "I'll help you analyze the data, build models and visualize the results.");
    }

    @Override
    public CapabilityRegistry capabilities() {
        return CapabilityRegistry.builder()
                .register(Capability.builder()
                                  .name("analyze_data")
                                  .description("Perform data analysis and insights")
                                  .inputSchema(InputSchemas.object()
                                                       .string("dataset", "Dataset to analyze")
                                                       .string("analysis_type", "Kind of analysis")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Perform %s data analysis on %s",
                                                text(args, "analysis_type", DEFAULT_ANALYSIS),
                                                text(args, "dataset")),
                                  "Data analysis"),
                          (name, args, suggestion) -> CapabilityResult.builder()
                                  .success(true)
                                  .result("Data analysis completed")
                                  .detail("analysis", suggestion)
                                  .detail("ai_generated", true)
                                  .build())
                .register(Capability.builder()
                                  .name("create_ml_model")
                                  .description("Create machine learning model")
                                  .inputSchema(InputSchemas.object()
                                                       .string("model_type", "Kind of model")
                                                       .string("problem", "Problem the model solves")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Create %s machine learning model for %s",
                                                text(args, "model_type"),
                                                text(args, "problem")),
                                  "ML model creation"),
                          (name, args, suggestion) -> CapabilityResult.success("ML model created", "code", suggestion))
                .register(Capability.builder()
                                  .name("data_visualization")
                                  .description("Create data visualizations")
                                  .inputSchema(InputSchemas.object()
                                                       .string("chart_type", "Kind of chart")
                                                       .string("data", "Data to plot")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Create %s visualization code using matplotlib/seaborn for %s",
                                                text(args, "chart_type"),
                                                text(args, "data", "the given data")),
                                  "Data visualization"),
                          (name, args, suggestion) -> CapabilityResult.success("Visualization created",
                                                                              "code",
                                                                              suggestion))
                .build();
    }
}
