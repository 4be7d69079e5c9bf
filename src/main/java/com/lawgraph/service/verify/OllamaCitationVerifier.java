package com.lawgraph.service.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lawgraph.exception.VerifierException;
import com.lawgraph.model.citation.Certainty;
import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.CitationKind;
import com.lawgraph.model.citation.CitationTarget;
import com.lawgraph.model.citation.ResolutionMethod;
import com.lawgraph.model.document.ArticleNumber;
import com.lawgraph.service.data.DictionaryLoaderService;
import com.lawgraph.service.resolve.LawIdentityResolver;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks a local Ollama model which law and article a weak citation points at.
 *
 * <p>The answer is only trusted after the law name resolves through the
 * dictionary (or names the citing law itself) and the article parses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "law-graph.verifier", name = "enabled", havingValue = "true")
public class OllamaCitationVerifier implements CitationVerifier {

    private static final String SYSTEM_PROMPT = """
            あなたは日本の法令の条文参照を解析する専門家です。
            与えられた参照表現が指している法令名と条番号を特定してください。
            必ず次の形式のJSONのみで回答してください:
            {"lawName": "法令名", "article": "条番号", "paragraph": 項番号またはnull}
            条番号は "90" や "32の2" のように書いてください。
            参照先が同じ法令の場合、lawName は "この法律" としてください。
            特定できない場合は {"lawName": null, "article": null, "paragraph": null} と回答してください。
            """;

    private static final Set<String> SELF_WORDS = Set.of("この法律", "本法", "同法", "当該法律");

    private static final Pattern ARTICLE = Pattern.compile(
            "^第?([〇一二三四五六七八九十百千万０-９0-9]+)条?((?:[の\\-_][〇一二三四五六七八九十百千万０-９0-9]+)*)$");

    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?\\s*|\\s*```$");

    private final ChatModel verifierChatModel;
    private final OllamaOptions verifierOllamaOptions;
    private final DictionaryLoaderService dictionaryLoaderService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    @CircuitBreaker(name = "verifier", fallbackMethod = "fallbackVerify")
    @Retry(name = "verifier")
    public Optional<Citation> verify(Citation candidate, String surroundingContext) {
        String content;
        try {
            log.debug("Verifying citation '{}' at {}", candidate.getText(), candidate.getSource());

            List<Message> messages = List.of(
                    new SystemMessage(SYSTEM_PROMPT),
                    new UserMessage(userPrompt(candidate, surroundingContext)));
            ChatResponse response = verifierChatModel.call(new Prompt(messages, verifierOllamaOptions));
            content = response.getResult().getOutput().getText();

        } catch (Exception e) {
            log.error("Error calling verifier model: {}", e.getMessage());
            throw new VerifierException("Verifier model call failed", e);
        }
        return interpret(candidate, content);
    }

    /**
     * Turn a model answer into an improved citation, or empty when it names
     * nothing usable.
     */
    Optional<Citation> interpret(Citation candidate, String content) {
        VerifierAnswer answer = parseAnswer(content);
        if (answer == null || answer.article() == null || answer.article().isBlank()) {
            log.debug("Verifier had no answer for '{}'", candidate.getText());
            return Optional.empty();
        }

        ArticleNumber article = parseArticle(answer.article().strip());
        if (article == null || !article.isValid()) {
            log.debug("Verifier article '{}' not understood", answer.article());
            return Optional.empty();
        }

        String sourceLawId = candidate.getSource().lawId();
        String lawId;
        if (answer.lawName() == null || answer.lawName().isBlank() || SELF_WORDS.contains(answer.lawName().strip())) {
            lawId = sourceLawId;
        } else {
            LawIdentityResolver resolver = dictionaryLoaderService.getResolver();
            Optional<String> resolved = resolver.resolve(answer.lawName().strip());
            if (resolved.isEmpty()) {
                log.debug("Verifier law name '{}' not in dictionary", answer.lawName());
                return Optional.empty();
            }
            lawId = resolved.get();
        }

        Integer paragraph = answer.paragraph() != null && answer.paragraph() > 0 ? answer.paragraph() : null;
        return Optional.of(candidate.toBuilder()
                .kind(lawId.equals(sourceLawId) ? CitationKind.INTERNAL : CitationKind.EXTERNAL)
                .target(CitationTarget.article(lawId, article, paragraph, null))
                .rangeEnd(null)
                .method(ResolutionMethod.VERIFIER)
                .certainty(Certainty.EXACT)
                .build());
    }

    // ============================================================
    // Private Helper Methods
    // ============================================================

    private String userPrompt(Citation candidate, String surroundingContext) {
        return "参照表現: " + candidate.getText() + "\n"
                + "出現箇所: " + candidate.getSource() + "\n"
                + "文脈: " + (surroundingContext == null ? "" : surroundingContext);
    }

    private VerifierAnswer parseAnswer(String content) {
        if (content == null || content.isBlank()) {
            return null;
        }
        String json = CODE_FENCE.matcher(content.strip()).replaceAll("");
        try {
            return objectMapper.readValue(json, VerifierAnswer.class);
        } catch (Exception e) {
            log.warn("Unparseable verifier answer: {}", e.getMessage());
            return null;
        }
    }

    static ArticleNumber parseArticle(String text) {
        Matcher m = ARTICLE.matcher(text);
        if (!m.matches()) {
            return null;
        }
        String branches = m.group(2).replace('-', 'の').replace('_', 'の');
        return ArticleNumber.fromText(m.group(1), branches);
    }

    private Optional<Citation> fallbackVerify(Citation candidate, String surroundingContext, Exception e) {
        log.warn("Verifier unavailable for '{}': {}", candidate.getText(), e.getMessage());
        return Optional.empty();
    }
}
