package com.team.detection.extract;

import com.team.detection.core.model.AnnotationPage;
import com.team.detection.core.model.ProfileDetails;
import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.core.model.RelationshipRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link RelationshipExtractor} for Steam Community pages requested with {@code ?l=english}.
 *
 * <p>Markup is read with jsoup selectors, so names come back with every HTML entity decoded. The
 * numeric identifier and the custom URL live in the {@code g_rgProfileData} script block rather than
 * in the DOM and are matched on the raw page.</p>
 */
public class SteamRelationshipExtractor implements RelationshipExtractor {
    private static final Logger log = LoggerFactory.getLogger(SteamRelationshipExtractor.class);

    private static final Pattern NUMERIC_ID_PATTERN = Pattern.compile(",\"steamid\":\"(.*?)\",", Pattern.DOTALL);
    // Slashes in the embedded profile JSON may or may not be escaped
    private static final Pattern ALIAS_PATTERN = Pattern.compile(
            "g_rgProfileData = \\{\"url\":\"https:(?:\\\\/|/){2}steamcommunity\\.com(?:\\\\/|/)id(?:\\\\/|/)([^/\\\\\"]+)");
    private static final Pattern PROFILE_LINK_PATTERN = Pattern.compile(
            "^https?://steamcommunity\\.com/(profiles|id)/([^/?#]+)");
    private static final Pattern NON_DIGITS = Pattern.compile("[^0-9]");

    private static final String DISPLAY_NAME_SELECTOR = ".persona_name .actual_persona_name";
    private static final String RELATIONSHIPS_LABEL_SELECTOR = "a[href$=/friends/] > span.count_link_label";
    private static final String ANNOTATIONS_LABEL_SELECTOR = "span.commentthread_header_label";
    private static final String ANNOTATION_TOTAL_SELECTOR = "span[id^=commentthread_][id$=_totalcount]";
    private static final String RELATIONSHIP_BLOCK_SELECTOR = "[data-steamid]";
    private static final String AUTHOR_LINK_SELECTOR = "a.commentthread_author_link[href]";

    @Override
    public ProfileDetails parseProfile(String content) {
        String numericId = firstGroup(NUMERIC_ID_PATTERN, content);
        if (numericId == null || numericId.isEmpty()) {
            throw new ExtractionException("numericId", "Numeric identifier not found in profile page");
        }
        String alias = firstGroup(ALIAS_PATTERN, content);

        Document doc = Jsoup.parse(content);
        Element nameElement = doc.selectFirst(DISPLAY_NAME_SELECTOR);
        String displayName;
        if (nameElement != null) {
            displayName = nameElement.wholeText();
        } else {
            log.warn("extract.displayName.missing numericId={}", numericId);
            displayName = "";
        }

        boolean relationshipsPublic = hasLabel(doc, RELATIONSHIPS_LABEL_SELECTOR, "Friends");
        boolean annotationsPublic = hasLabel(doc, ANNOTATIONS_LABEL_SELECTOR, "Comments");
        int annotationTotal = annotationsPublic ? annotationTotal(doc) : 0;

        ProfileDetails details = new ProfileDetails(numericId, alias != null ? alias : "",
                displayName, relationshipsPublic, annotationsPublic, annotationTotal);
        log.debug("extract.profile numericId={} alias='{}' relationshipsPublic={} annotationsPublic={} annotations={}",
                numericId, details.aliasId(), relationshipsPublic, annotationsPublic, annotationTotal);
        return details;
    }

    @Override
    public List<RelationshipRecord> parseRelationshipList(String content) {
        List<RelationshipRecord> records = new ArrayList<>();
        Document doc = Jsoup.parse(content);
        for (Element block : doc.select(RELATIONSHIP_BLOCK_SELECTOR)) {
            Element nameElement = block.selectFirst(".friend_block_content");
            String numericId = block.attr("data-steamid").trim();
            if (nameElement == null || numericId.isEmpty()) {
                continue;
            }
            Element link = block.selectFirst("a[href]");
            String alias = null;
            if (link != null) {
                Matcher matcher = PROFILE_LINK_PATTERN.matcher(link.attr("href"));
                if (matcher.find() && "id".equals(matcher.group(1))) {
                    alias = matcher.group(2);
                }
            }
            records.add(RelationshipRecord.relationship(
                    ProfileIdentity.of(numericId, alias, textBeforeLineBreak(nameElement))));
        }
        log.debug("extract.relationships count={}", records.size());
        return records;
    }

    @Override
    public AnnotationPage parseAnnotationPage(String content) {
        List<RelationshipRecord> authors = new ArrayList<>();
        int authorsRead = 0;

        Document doc = Jsoup.parse(content);
        for (Element link : doc.select(AUTHOR_LINK_SELECTOR)) {
            Matcher matcher = PROFILE_LINK_PATTERN.matcher(link.attr("href"));
            if (!matcher.find()) {
                continue;
            }
            authorsRead++;
            Element bdi = link.selectFirst("bdi");
            String name = bdi != null ? bdi.wholeText() : link.text();
            ProfileIdentity author = "profiles".equals(matcher.group(1))
                    ? ProfileIdentity.ofNumeric(matcher.group(2), name)
                    : ProfileIdentity.ofAlias(matcher.group(2), name);
            addDistinct(authors, author);
        }

        log.debug("extract.annotations read={} distinct={}", authorsRead, authors.size());
        return new AnnotationPage(authorsRead, authors);
    }

    private static void addDistinct(List<RelationshipRecord> authors, ProfileIdentity author) {
        boolean seen = authors.stream().anyMatch(r -> r.identity().sameIdentityAs(author));
        if (!seen) {
            authors.add(RelationshipRecord.annotation(author));
        }
    }

    private static boolean hasLabel(Document doc, String selector, String label) {
        return doc.select(selector).stream().anyMatch(e -> label.equalsIgnoreCase(e.text().trim()));
    }

    private static int annotationTotal(Document doc) {
        Element total = doc.selectFirst(ANNOTATION_TOTAL_SELECTOR);
        if (total == null) {
            return 0;
        }
        String raw = total.text();
        String digits = NON_DIGITS.matcher(raw).replaceAll("");
        if (digits.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            log.warn("extract.annotationTotal.unreadable value='{}'", raw);
            return 0;
        }
    }

    // The friend name is the text ahead of the <br>; the status line follows it
    private static String textBeforeLineBreak(Element element) {
        StringBuilder name = new StringBuilder();
        for (Node child : element.childNodes()) {
            if (child instanceof Element && "br".equals(((Element) child).normalName())) {
                break;
            }
            if (child instanceof TextNode) {
                name.append(((TextNode) child).getWholeText());
            } else if (child instanceof Element) {
                name.append(((Element) child).wholeText());
            }
        }
        return name.toString().trim();
    }

    private static String firstGroup(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        return matcher.find() ? matcher.group(1) : null;
    }
}
