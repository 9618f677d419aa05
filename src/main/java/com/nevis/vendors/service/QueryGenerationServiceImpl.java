package com.nevis.vendors.service;

import com.nevis.vendors.config.PipelineProperties;
import com.nevis.vendors.exception.PermanentServiceException;
import com.nevis.vendors.infra.CancellationToken;
import com.nevis.vendors.infra.Dispatcher;
import com.nevis.vendors.infra.TaskResult;
import com.nevis.vendors.infra.WorkUnit;
import com.nevis.vendors.model.ServiceType;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
public class QueryGenerationServiceImpl implements QueryGenerationService {

    static final String CATEGORIES_PROMPT_TEMPLATE = """
        You are an expert event planner. List the kinds of vendors needed to organise the event below.

        Event description: "%s"

        Rules:
        - Return at most %d vendor categories.
        - Use short lowercase nouns that a business would use to describe itself, e.g. "catering", "florist", "photographer".
        - Return ONLY a comma-separated list of categories, nothing else.
        """;

    static final String SEARCH_QUERY_PROMPT_TEMPLATE = """
        You are an expert event planner. Write one search query for finding "%s" vendors on a maps search engine for the event below.

        Event description: "%s"

        Keep it under ten words, include the theme or style of the event when it matters for this vendor,
        and do not include a location. Return ONLY the query, nothing else.
        """;

    static final String OPTIMIZED_QUERY_PROMPT_TEMPLATE = """
        You are an expert event planner. Based on the following event description, generate a concise and specific
        search query that would be most effective for finding relevant vendors (decorators, caterers, venues, etc.).

        Event description: "%s"

        Identify the type, theme, scale and special requirements of the event, and include keywords vendors would use
        to describe their services. Return ONLY the search query, nothing else.

        Examples:
        - For "birthday party for 5-year-old with superhero theme": superhero themed birthday party decorations children entertainment
        - For "corporate conference for 200 people": corporate event management conference setup professional catering
        """;

    private final Dispatcher dispatcher;
    private final ChatModel chatModel;
    private final int maxCategories;

    public QueryGenerationServiceImpl(@Qualifier("queryGenerationDispatcher") Dispatcher dispatcher,
                                      ChatModel chatModel,
                                      PipelineProperties pipelineProperties) {
        this.dispatcher = dispatcher;
        this.chatModel = chatModel;
        this.maxCategories = pipelineProperties.maxCategories();
    }

    @Override
    public TaskResult<List<String>> deriveCategories(String eventDescription, CancellationToken cancellation) {
        WorkUnit<List<String>> unit = dispatcher.unit("categories", () -> {
            String answer = ask(String.format(CATEGORIES_PROMPT_TEMPLATE, eventDescription, maxCategories));
            List<String> categories = parseCategories(answer, maxCategories);
            if (categories.isEmpty()) {
                throw new PermanentServiceException(ServiceType.QUERY_GENERATION, "no categories in model answer");
            }
            log.info("Derived vendor categories: {}", categories);
            return categories;
        });
        return dispatcher.dispatchOne(unit, cancellation);
    }

    @Override
    public Map<String, TaskResult<String>> generateQueries(String eventDescription, List<String> categories,
                                                          CancellationToken cancellation) {
        List<WorkUnit<String>> units = categories.stream()
            .map(category -> dispatcher.unit(category,
                () -> cleanQuery(ask(String.format(SEARCH_QUERY_PROMPT_TEMPLATE, category, eventDescription)))))
            .toList();

        return TaskResult.byKey(dispatcher.dispatch(units, cancellation));
    }

    @Override
    public String optimizeQuery(String eventDescription) {
        WorkUnit<String> unit = dispatcher.unit("optimized-query",
            () -> cleanQuery(ask(String.format(OPTIMIZED_QUERY_PROMPT_TEMPLATE, eventDescription))));

        String query = dispatcher.dispatchOne(unit, CancellationToken.create()).getOrThrow();
        log.debug("Optimized query: '{}'", query);
        return query;
    }

    private String ask(String prompt) {
        String answer = chatModel.chat(prompt);
        if (answer == null || answer.isBlank()) {
            throw new PermanentServiceException(ServiceType.QUERY_GENERATION, "model returned an empty answer");
        }
        return answer.trim();
    }

    static List<String> parseCategories(String answer, int limit) {
        if (answer == null || answer.isBlank()) {
            return List.of();
        }
        return Arrays.stream(answer.split("[,\\n]"))
            .map(s -> s.replaceAll("^[\\s*\\-\\d.\"']+|[\\s.\"']+$", ""))
            .map(s -> s.toLowerCase(Locale.ROOT))
            .filter(s -> !s.isBlank())
            .distinct()
            .limit(limit)
            .toList();
    }

    static String cleanQuery(String answer) {
        String query = answer.strip();
        if (query.length() > 1 && query.startsWith("\"") && query.endsWith("\"")) {
            query = query.substring(1, query.length() - 1).strip();
        }
        if (query.isBlank()) {
            throw new PermanentServiceException(ServiceType.QUERY_GENERATION, "model returned an empty query");
        }
        return query;
    }
}
