package com.lawgraph.service.matcher;

import com.lawgraph.model.citation.CitationRole;
import com.lawgraph.model.citation.Span;
import com.lawgraph.model.document.NodeType;
import com.lawgraph.service.matcher.CitationCandidate.ArticleCandidate;
import com.lawgraph.service.matcher.CitationCandidate.ContextualCandidate;
import com.lawgraph.service.matcher.CitationCandidate.ContextualForm;
import com.lawgraph.service.matcher.CitationCandidate.ContinuationCandidate;
import com.lawgraph.service.matcher.CitationCandidate.ExternalCandidate;
import com.lawgraph.service.matcher.CitationCandidate.RangeCandidate;
import com.lawgraph.service.matcher.CitationCandidate.RelativeCandidate;
import com.lawgraph.service.matcher.CitationCandidate.RelativeDirection;
import com.lawgraph.service.matcher.CitationCandidate.RelativeStructuralCandidate;
import com.lawgraph.service.matcher.CitationCandidate.RelativeUnit;
import com.lawgraph.service.matcher.CitationCandidate.StructuralCandidate;
import com.lawgraph.service.matcher.CitationCandidate.StructureStep;
import com.lawgraph.service.resolve.LawIdentityResolver;
import com.lawgraph.service.resolve.LawMatch;
import com.lawgraph.util.KanjiNumerals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds citation candidates in one unit of statute text.
 *
 * <p>All pattern families run over the whole text; overlapping hits are then
 * settled greedily, longest first, ties going to the family listed first in
 * {@link Family}. Candidates come back unresolved and in source order.
 * Stateless: per-law state (defined alias terms) is passed in by the caller.
 */
@Slf4j
@Component
public class CitationPatternMatcher {

    private static final String NUM = Locator.NUM;
    private static final String LOC = Locator.TEXT;

    private static final String NAME = "[^\\s　、。，．,（）()「」『』]+?(?:法律|法|政令|省令|規則|条例|令)";
    private static final String ERA = "(?:明治|大正|昭和|平成|令和)";
    private static final String PROMULGATION_NUMBER =
            ERA + "(?:" + NUM + "|元)年(?:法律|政令|勅令|[^\\s　、。（）「」]{0,12}?省令|規則|条例|告示)第" + NUM + "号";
    private static final String CLAUSE =
            "（(?:(" + PROMULGATION_NUMBER + ")。?)?(?:以下「([^」]+)」という。?)?）";

    private static final Pattern RANGE = Pattern.compile("(" + LOC + ")から(" + LOC + ")まで");
    private static final Pattern PROMULGATION = Pattern.compile("(" + PROMULGATION_NUMBER + ")(" + LOC + ")?");
    private static final Pattern EXTERNAL = Pattern.compile("(" + NAME + ")(?:" + CLAUSE + "(" + LOC + ")?|(" + LOC + "))");
    private static final Pattern SELF_INTERNAL = Pattern.compile("(?:この法律|(?<!\\p{IsHan})本法)(" + LOC + ")");
    private static final Pattern SAME_LAW = Pattern.compile("(?<!\\p{IsHan})同法(?!人)(" + LOC + ")?");
    private static final Pattern UNSPECIFIED = Pattern.compile("他の法令|別に法律で定める|政令で定める|省令で定める");
    private static final Pattern RELATIVE = Pattern.compile(
            "(前々|次々|前各|前|次|(?<!\\p{IsHan})同|(?<!\\p{IsHan})本)(" + NUM + ")?(条|項|号)(?![件例約目文])"
                    + "(?:第(" + NUM + ")項)?(?:第(" + NUM + ")号)?");
    private static final Pattern STRUCTURAL = Pattern.compile("(?:第" + NUM + "[編章節款目])+");
    private static final Pattern STRUCTURE_STEP = Pattern.compile("第(" + NUM + ")([編章節款目])");
    private static final Pattern RELATIVE_STRUCTURAL = Pattern.compile("(前|次|本|この)(編|章|節|款)");
    private static final Pattern INTERNAL = Pattern.compile(LOC);

    private static final Pattern DEFINITION = Pattern.compile(
            "(" + NAME + ")（(?:" + PROMULGATION_NUMBER + "。?)?以下「([^」]+)」という。?）");

    private static final Pattern PREFIX_SELF = Pattern.compile("(?:この法律|(?<!\\p{IsHan})本法)$");
    private static final Pattern PREFIX_SAME_LAW = Pattern.compile("(?<!\\p{IsHan})同法$");
    private static final Pattern PREFIX_PROMULGATION = Pattern.compile("(" + PROMULGATION_NUMBER + ")$");
    private static final Pattern PREFIX_RELATIVE = Pattern.compile(
            "(前々|次々|前|次|(?<!\\p{IsHan})同|(?<!\\p{IsHan})本)(" + NUM + ")?条$");
    private static final Pattern PREFIX_NAME = Pattern.compile("(" + NAME + ")(?:" + CLAUSE + ")?$");

    private static final Pattern CONJUNCTION = Pattern.compile("及び|並びに|又は|若しくは|[、，,]");
    private static final Pattern PROMULGATION_TAIL = Pattern.compile(ERA + ".*年(?:法律|政令|勅令|省令|規則|条例|告示)$");
    private static final Pattern CONNECTIVE = Pattern.compile(
            "において|について|により|による|に基づく|に規定する|に定める|及び|並びに|又は|若しくは|とは|は|が|も|を");
    private static final Pattern LEADING_KANA = Pattern.compile("^[\\p{IsHiragana}ー]+");
    private static final Pattern DELETION_AFTER = Pattern.compile("^(?:[\\s　]*削除|を削る|を削り)");

    private static final Set<String> SELF_WORDS = Set.of("この法律", "本法", "同法", "当該法", "この法");
    private static final Set<String> GENERIC_WORDS = Set.of(
            "法", "法律", "法令", "政令", "省令", "命令", "勅令", "規則", "条例", "府令", "訓令", "指令");
    private static final List<String> NEGATIVE_ENDINGS = List.of(
            "方法", "手法", "用法", "違法", "適法", "不法", "合法", "製法", "寸法", "文法", "作法");
    private static final Set<String> PROMULGATION_PRECEDERS = Set.of("法律", "政令", "省令", "規則", "告示", "令", "条例", "様式", "別記");

    private static final List<RoleMarker> ROLE_MARKERS = List.of(
            new RoleMarker("準用する", CitationRole.APPLICATION),
            new RoleMarker("準用し", CitationRole.APPLICATION),
            new RoleMarker("読み替える", CitationRole.READ_AS),
            new RoleMarker("読み替えて", CitationRole.READ_AS),
            new RoleMarker("を除く", CitationRole.EXCEPTION),
            new RoleMarker("を除き", CitationRole.EXCEPTION));

    /**
     * Pattern families in precedence order: on equal span length the earlier family wins.
     */
    enum Family {
        RANGE,
        PROMULGATION,
        EXTERNAL,
        SELF_INTERNAL,
        CONTEXTUAL,
        RELATIVE,
        STRUCTURAL,
        INTERNAL
    }

    private record Hit(int start, int end, CitationCandidate candidate, Family family) {

        int length() {
            return end - start;
        }

        boolean overlaps(Hit other) {
            return start < other.end && other.start < end;
        }
    }

    private record RoleMarker(String text, CitationRole role) {
    }

    /**
     * A refined law name: where it starts in the text and what it resolved to.
     */
    private record NameRef(String name, int start, LawMatch match) {
    }

    public MatchResult match(String text, LawIdentityResolver resolver, Set<String> aliasTerms) {
        if (text == null || text.isBlank()) {
            return MatchResult.empty();
        }
        Set<String> terms = aliasTerms == null ? Set.of() : aliasTerms;

        List<Hit> hits = new ArrayList<>();
        matchRanges(text, resolver, terms, hits);
        matchPromulgations(text, resolver, hits);
        matchExternal(text, resolver, terms, hits);
        matchSelfInternal(text, hits);
        matchContextual(text, terms, hits);
        matchRelative(text, hits);
        matchStructural(text, hits);
        matchInternal(text, hits);

        List<Hit> accepted = suppressOverlaps(hits);
        List<MatchedCitation> citations = toCitations(text, accepted);
        log.debug("Matched {} citations from {} raw hits", citations.size(), hits.size());
        return new MatchResult(citations);
    }

    /**
     * Defining phrases that introduce a short name for another law.
     * Definitions of non-law terms are ignored.
     */
    public List<AliasDefinitionMatch> findDefinitions(String text, LawIdentityResolver resolver) {
        List<AliasDefinitionMatch> definitions = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return definitions;
        }
        Matcher m = DEFINITION.matcher(text);
        while (m.find()) {
            Optional<NameRef> ref = refineName(m.group(1), m.start(1), resolver, Set.of());
            if (ref.isPresent()) {
                definitions.add(new AliasDefinitionMatch(m.group(2), ref.get().name(),
                        new Span(ref.get().start(), m.end())));
            }
        }
        return definitions;
    }

    // ============================================================
    // Pattern families
    // ============================================================

    private void matchRanges(String text, LawIdentityResolver resolver, Set<String> terms, List<Hit> out) {
        Matcher m = RANGE.matcher(text);
        while (m.find()) {
            Locator start = Locator.parse(m.group(1));
            Locator end = Locator.parse(m.group(2));
            String before = text.substring(0, m.start());

            int spanStart = m.start();
            ExternalCandidate law = null;
            boolean sameLaw = false;
            RelativeCandidate relative = null;

            Matcher p;
            if ((p = PREFIX_SELF.matcher(before)).find()) {
                spanStart = p.start();
            } else if ((p = PREFIX_SAME_LAW.matcher(before)).find()) {
                spanStart = p.start();
                sameLaw = true;
            } else if (!start.hasArticle() && (p = PREFIX_RELATIVE.matcher(before)).find()) {
                spanStart = p.start();
                relative = relativeCandidate(p.group(1), p.group(2), "条", null, null);
            } else if ((p = PREFIX_PROMULGATION.matcher(before)).find()) {
                spanStart = p.start();
                law = new ExternalCandidate(p.group(1), resolver.resolveMatch(p.group(1)).orElse(null), p.group(1), null);
            } else if ((p = PREFIX_NAME.matcher(before)).find()) {
                Optional<NameRef> ref = refineName(p.group(1), p.start(1), resolver, terms);
                if (ref.isPresent()) {
                    spanStart = ref.get().start();
                    LawMatch match = ref.get().match();
                    if (match == null && p.group(2) != null) {
                        match = resolver.resolveMatch(p.group(2)).orElse(null);
                    }
                    law = new ExternalCandidate(ref.get().name(), match, p.group(2), null);
                }
            }
            out.add(new Hit(spanStart, m.end(), new RangeCandidate(start, end, law, sameLaw, relative), Family.RANGE));
        }
    }

    private void matchPromulgations(String text, LawIdentityResolver resolver, List<Hit> out) {
        Matcher m = PROMULGATION.matcher(text);
        while (m.find()) {
            Optional<LawMatch> match = resolver.resolveMatch(m.group(1));
            Locator locator = m.group(2) != null ? Locator.parse(m.group(2)) : null;
            // a bare promulgation number only counts when it identifies a known law
            if (match.isEmpty() && locator == null) {
                continue;
            }
            out.add(new Hit(m.start(), m.end(),
                    new ExternalCandidate(m.group(1), match.orElse(null), m.group(1), locator), Family.PROMULGATION));
        }
    }

    private void matchExternal(String text, LawIdentityResolver resolver, Set<String> terms, List<Hit> out) {
        Matcher m = EXTERNAL.matcher(text);
        while (m.find()) {
            String promulgation = m.group(2);
            String definedTerm = m.group(3);
            String locatorText = m.group(4) != null ? m.group(4) : m.group(5);
            if (promulgation == null && definedTerm == null && locatorText == null) {
                continue;
            }
            Optional<NameRef> ref = refineName(m.group(1), m.start(1), resolver, terms);
            if (ref.isEmpty()) {
                continue;
            }
            LawMatch match = ref.get().match();
            if (match == null && promulgation != null) {
                match = resolver.resolveMatch(promulgation).orElse(null);
            }
            Locator locator = locatorText != null ? Locator.parse(locatorText) : null;
            out.add(new Hit(ref.get().start(), m.end(),
                    new ExternalCandidate(ref.get().name(), match, promulgation, locator), Family.EXTERNAL));
        }
    }

    private void matchSelfInternal(String text, List<Hit> out) {
        Matcher m = SELF_INTERNAL.matcher(text);
        while (m.find()) {
            if (isDeletion(text, m.end())) {
                continue;
            }
            out.add(new Hit(m.start(), m.end(), new ArticleCandidate(Locator.parse(m.group(1)), true), Family.SELF_INTERNAL));
        }
    }

    private void matchContextual(String text, Set<String> terms, List<Hit> out) {
        Matcher m = SAME_LAW.matcher(text);
        while (m.find()) {
            Locator locator = m.group(1) != null ? Locator.parse(m.group(1)) : null;
            out.add(new Hit(m.start(), m.end(),
                    new ContextualCandidate(ContextualForm.SAME_LAW, "同法", locator), Family.CONTEXTUAL));
        }

        m = UNSPECIFIED.matcher(text);
        while (m.find()) {
            ContextualForm form;
            switch (m.group()) {
                case "他の法令" -> form = ContextualForm.OTHER_LAWS;
                case "別に法律で定める" -> form = ContextualForm.BY_LAW;
                case "政令で定める" -> form = ContextualForm.CABINET_ORDER;
                default -> form = ContextualForm.MINISTERIAL_ORDINANCE;
            }
            out.add(new Hit(m.start(), m.end(), new ContextualCandidate(form, m.group(), null), Family.CONTEXTUAL));
        }

        if (terms.isEmpty()) {
            return;
        }
        String alternation = terms.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        m = Pattern.compile("(?<![「])(" + alternation + ")(?![」])(" + LOC + ")?").matcher(text);
        while (m.find()) {
            Locator locator = m.group(2) != null ? Locator.parse(m.group(2)) : null;
            out.add(new Hit(m.start(), m.end(),
                    new ContextualCandidate(ContextualForm.ALIAS, m.group(1), locator), Family.CONTEXTUAL));
        }
    }

    private void matchRelative(String text, List<Hit> out) {
        Matcher m = RELATIVE.matcher(text);
        while (m.find()) {
            RelativeCandidate candidate = relativeCandidate(m.group(1), m.group(2), m.group(3),
                    m.group(4), m.group(5));
            if (candidate != null) {
                out.add(new Hit(m.start(), m.end(), candidate, Family.RELATIVE));
            }
        }
    }

    private void matchStructural(String text, List<Hit> out) {
        Matcher m = STRUCTURAL.matcher(text);
        while (m.find()) {
            List<StructureStep> steps = new ArrayList<>();
            Matcher step = STRUCTURE_STEP.matcher(m.group());
            while (step.find()) {
                steps.add(new StructureStep(NodeType.fromSuffix(step.group(2).charAt(0)), KanjiNumerals.parse(step.group(1))));
            }
            out.add(new Hit(m.start(), m.end(), new StructuralCandidate(steps), Family.STRUCTURAL));
        }

        m = RELATIVE_STRUCTURAL.matcher(text);
        while (m.find()) {
            RelativeDirection direction = switch (m.group(1)) {
                case "前" -> RelativeDirection.PRECEDING;
                case "次" -> RelativeDirection.FOLLOWING;
                default -> RelativeDirection.SAME;
            };
            out.add(new Hit(m.start(), m.end(),
                    new RelativeStructuralCandidate(NodeType.fromSuffix(m.group(2).charAt(0)), direction),
                    Family.STRUCTURAL));
        }
    }

    private void matchInternal(String text, List<Hit> out) {
        Matcher m = INTERNAL.matcher(text);
        while (m.find()) {
            Locator locator = Locator.parse(m.group());
            if (isDeletion(text, m.end())) {
                continue;
            }
            if (!locator.hasArticle() && locator.paragraph() == null && followsPromulgationType(text, m.start())) {
                continue;
            }
            out.add(new Hit(m.start(), m.end(), new ArticleCandidate(locator, false), Family.INTERNAL));
        }
    }

    // ============================================================
    // Overlaps, continuations and roles
    // ============================================================

    private List<Hit> suppressOverlaps(List<Hit> hits) {
        List<Hit> ordered = new ArrayList<>(hits);
        ordered.sort(Comparator.comparingInt(Hit::length).reversed()
                .thenComparing(Hit::family)
                .thenComparingInt(Hit::start));

        List<Hit> accepted = new ArrayList<>();
        for (Hit hit : ordered) {
            if (accepted.stream().noneMatch(hit::overlaps)) {
                accepted.add(hit);
            }
        }
        accepted.sort(Comparator.comparingInt(Hit::start));
        return accepted;
    }

    private List<MatchedCitation> toCitations(String text, List<Hit> accepted) {
        List<MatchedCitation> citations = new ArrayList<>();
        for (int i = 0; i < accepted.size(); i++) {
            Hit hit = accepted.get(i);
            CitationCandidate candidate = hit.candidate();

            if (i > 0 && candidate instanceof ArticleCandidate article && !article.explicitSelf()) {
                Hit previous = accepted.get(i - 1);
                String gap = text.substring(previous.end(), hit.start());
                if (CONJUNCTION.matcher(gap).matches() && canAnchor(previous.candidate())) {
                    candidate = new ContinuationCandidate(article.locator(), i - 1);
                }
            }
            citations.add(new MatchedCitation(i, candidate, text.substring(hit.start(), hit.end()),
                    new Span(hit.start(), hit.end()), roleAfter(text, hit.end())));
        }
        return citations;
    }

    private static boolean canAnchor(CitationCandidate candidate) {
        if (candidate instanceof ContextualCandidate contextual) {
            return !contextual.form().isUnspecifiable();
        }
        return !(candidate instanceof StructuralCandidate) && !(candidate instanceof RelativeStructuralCandidate);
    }

    /**
     * Role given by the nearest marker after {@code from} in the same sentence and
     * parenthesis level. Markers inside nested parentheses do not count.
     */
    static CitationRole roleAfter(String text, int from) {
        int depth = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '（' || c == '(') {
                depth++;
            } else if (c == '）' || c == ')') {
                if (depth == 0) {
                    break;
                }
                depth--;
            } else if (c == '。' && depth == 0) {
                break;
            } else if (depth == 0) {
                for (RoleMarker marker : ROLE_MARKERS) {
                    if (text.startsWith(marker.text(), i)) {
                        return marker.role();
                    }
                }
            }
        }
        return CitationRole.REFERENCE;
    }

    // ============================================================
    // Helpers
    // ============================================================

    private static RelativeCandidate relativeCandidate(String prefix, String numeral, String unitChar,
                                                       String paragraph, String item) {
        RelativeUnit unit = switch (unitChar) {
            case "条" -> RelativeUnit.ARTICLE;
            case "項" -> RelativeUnit.PARAGRAPH;
            default -> RelativeUnit.ITEM;
        };
        int distance = numeral != null ? KanjiNumerals.parse(numeral) : 1;
        RelativeDirection direction;
        switch (prefix) {
            case "前々" -> {
                direction = RelativeDirection.PRECEDING;
                distance = 2;
            }
            case "次々" -> {
                direction = RelativeDirection.FOLLOWING;
                distance = 2;
            }
            case "前各" -> direction = RelativeDirection.ALL_PRECEDING;
            case "前" -> direction = RelativeDirection.PRECEDING;
            case "次" -> direction = RelativeDirection.FOLLOWING;
            default -> direction = RelativeDirection.SAME;
        }

        boolean numbered = numeral != null;
        if (numbered && (direction == RelativeDirection.SAME || direction == RelativeDirection.ALL_PRECEDING
                || "前々".equals(prefix) || "次々".equals(prefix))) {
            return null;
        }
        if (direction == RelativeDirection.ALL_PRECEDING && unit == RelativeUnit.ARTICLE) {
            return null;
        }
        if (distance <= 0) {
            return null;
        }

        Integer paragraphQualifier = unit == RelativeUnit.ARTICLE && paragraph != null ? KanjiNumerals.parse(paragraph) : null;
        Integer itemQualifier = unit != RelativeUnit.ITEM && item != null ? KanjiNumerals.parse(item) : null;
        return new RelativeCandidate(unit, direction, distance, paragraphQualifier, itemQualifier);
    }

    /**
     * Reduce a lazily matched law name to the law it actually names.
     * Empty when the text names this law, a defined alias or no law at all.
     */
    private Optional<NameRef> refineName(String raw, int rawStart, LawIdentityResolver resolver, Set<String> terms) {
        // longest suffix the dictionary knows exactly
        for (int i = 0; i <= raw.length() - 2; i++) {
            String suffix = raw.substring(i);
            if (resolver.getDictionary().findByName(suffix).isPresent()
                    || resolver.getDictionary().findByAlias(suffix).isPresent()) {
                if (terms.contains(suffix)) {
                    return Optional.empty();
                }
                return resolver.resolveMatch(suffix).map(match -> new NameRef(suffix, rawStart + raw.length() - suffix.length(), match));
            }
        }

        String name = raw;
        Matcher connective = CONNECTIVE.matcher(name);
        int cut = 0;
        while (connective.find()) {
            if (connective.end() < name.length()) {
                cut = connective.end();
            }
        }
        name = name.substring(cut);
        Matcher kana = LEADING_KANA.matcher(name);
        if (kana.find() && kana.end() < name.length()) {
            name = name.substring(kana.end());
        }

        if (name.length() < 2 || SELF_WORDS.contains(name) || GENERIC_WORDS.contains(name)
                || name.endsWith("この法律") || terms.contains(name)
                || terms.stream().anyMatch(name::endsWith)
                || PROMULGATION_TAIL.matcher(name).find()) {
            return Optional.empty();
        }
        for (String negative : NEGATIVE_ENDINGS) {
            if (name.endsWith(negative)) {
                return Optional.empty();
            }
        }

        int start = rawStart + raw.length() - name.length();
        Optional<LawMatch> match = resolver.resolveMatch(name);
        if (match.isPresent() && match.get().type() == LawMatch.MatchType.SUBSTRING
                && name.endsWith(match.get().matchedName()) && !name.equals(match.get().matchedName())) {
            String known = match.get().matchedName();
            return Optional.of(new NameRef(known, start + name.length() - known.length(), match.get()));
        }
        return Optional.of(new NameRef(name, start, match.orElse(null)));
    }

    private static boolean isDeletion(String text, int end) {
        return DELETION_AFTER.matcher(text.substring(end)).find();
    }

    /**
     * 法律第八十九号 and 様式第一号 are document numbers, not item references.
     */
    private static boolean followsPromulgationType(String text, int start) {
        for (String preceder : PROMULGATION_PRECEDERS) {
            if (start >= preceder.length() && text.startsWith(preceder, start - preceder.length())) {
                return true;
            }
        }
        return false;
    }
}
