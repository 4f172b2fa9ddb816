package ou.capstone.fantasy.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fantasy.exceptions.ProviderException;

/**
 * Reads PDGA search and event pages. All knowledge of the site's markup lives here.
 */
public class PdgaPageParser {
    private static final Logger logger = LoggerFactory.getLogger(PdgaPageParser.class);

    private static final Pattern EVENT_LINK_PATTERN = Pattern.compile("/tour/event/(\\d+)");

    // Loose match for event ids embedded anywhere in a search page
    private static final Pattern EVENT_ID_FALLBACK_PATTERN = Pattern.compile("event[/_](\\d{5,})");

    private static final Pattern PLAYER_LINK_PATTERN = Pattern.compile("/player/(\\d+)");

    private static final Pattern FIRST_NUMBER_PATTERN = Pattern.compile("(\\d+)");

    private static final Pattern DIVISION_CODE_PATTERN = Pattern.compile("[A-Za-z0-9]+");

    /**
     * Finds the first event id on a tour search results page.
     *
     * @param html the search page
     * @return the event id, or empty when the page lists no event
     */
    public Optional<String> parseSearchResults(final String html) {
        if (StringUtils.isBlank(html)) {
            return Optional.empty();
        }

        final Document doc = Jsoup.parse(html);
        final Element link = doc.selectFirst("a[href~=/tour/event/\\d+]");
        if (link != null) {
            final Matcher m = EVENT_LINK_PATTERN.matcher(link.attr("href"));
            if (m.find()) {
                logger.debug("Search page links to event {}", m.group(1));
                return Optional.of(m.group(1));
            }
        }

        final Matcher fallback = EVENT_ID_FALLBACK_PATTERN.matcher(html);
        if (fallback.find()) {
            logger.debug("Search page mentions event {} outside a result link", fallback.group(1));
            return Optional.of(fallback.group(1));
        }
        return Optional.empty();
    }

    /**
     * Extracts the event name from the page title ("Name | PDGA").
     *
     * @return the name, or empty if the page has no usable title
     */
    public Optional<String> parseEventName(final String html) {
        if (StringUtils.isBlank(html)) {
            return Optional.empty();
        }
        final String title = Jsoup.parse(html).title();
        final String name = StringUtils.trimToNull(StringUtils.substringBefore(title, "|"));
        return Optional.ofNullable(name);
    }

    /**
     * Parses the results table of one division on an event page.
     *
     * @param html     the event page
     * @param division division code, e.g. "MPO"
     * @return rows in page order; rows without a placement or PDGA number are skipped
     * @throws ProviderException if the division or its results table is absent
     */
    public List<ResultRow> parseResults(final String html, final String division) throws ProviderException {
        if (division == null || !DIVISION_CODE_PATTERN.matcher(division).matches()) {
            throw new IllegalArgumentException("Invalid division code: " + division);
        }
        if (StringUtils.isBlank(html)) {
            throw new ProviderException("Event page is empty");
        }

        final Document doc = Jsoup.parse(html);
        final Element header = doc.selectFirst("h3.division[id=" + division + "]");
        if (header == null) {
            throw new ProviderException("No " + division + " division found on event page");
        }

        final Element table = findResultsTable(doc, header);
        if (table == null) {
            throw new ProviderException("No results table found for " + division + " division");
        }

        List<Element> rows = table.select("tbody tr");
        if (rows.isEmpty()) {
            // Tables without a tbody: everything after the header row
            final Elements all = table.select("tr");
            rows = all.isEmpty() ? List.of() : all.subList(1, all.size());
        }

        final List<ResultRow> results = new ArrayList<>();
        int skipped = 0;
        for (final Element row : rows) {
            final Optional<ResultRow> parsed = parseRow(row);
            if (parsed.isPresent()) {
                results.add(parsed.get());
            } else {
                skipped++;
            }
        }

        logger.info("Parsed {} {} result row(s), skipped {}", results.size(), division, skipped);
        return results;
    }

    private static Element findResultsTable(final Document doc, final Element header) {
        final Element details = header.closest("details");
        if (details != null) {
            final Element inside = details.selectFirst("table.results");
            if (inside != null) {
                return inside;
            }
        }

        // Next results table in document order
        boolean seenHeader = false;
        for (final Element el : doc.getAllElements()) {
            if (el == header) {
                seenHeader = true;
            } else if (seenHeader && el.is("table.results")) {
                return el;
            }
        }
        return null;
    }

    private static Optional<ResultRow> parseRow(final Element row) {
        final Element placeCell = row.selectFirst("td.place");
        if (placeCell == null) {
            return Optional.empty();
        }
        final String placeText = placeCell.text();
        final Matcher placeMatcher = FIRST_NUMBER_PATTERN.matcher(placeText);
        if (!placeMatcher.find()) {
            logger.debug("Skipping row without a placement: '{}'", placeText);
            return Optional.empty();
        }
        final int placement;
        try {
            placement = Integer.parseInt(placeMatcher.group(1));
        } catch (NumberFormatException e) {
            logger.debug("Skipping row with oversized placement '{}'", placeText);
            return Optional.empty();
        }
        if (placement <= 0) {
            return Optional.empty();
        }
        final boolean tied = placeText.toUpperCase(Locale.ROOT).contains("T");

        Element playerLink = row.selectFirst("td.player a");
        if (playerLink == null) {
            playerLink = row.selectFirst("a[href~=/player/\\d+]");
        }
        if (playerLink == null) {
            logger.debug("Skipping row without a player link at place {}", placement);
            return Optional.empty();
        }
        final String name = StringUtils.normalizeSpace(playerLink.text());
        if (name.isEmpty()) {
            return Optional.empty();
        }

        final Optional<Long> pdgaNumber = pdgaNumberFrom(playerLink, row);
        if (pdgaNumber.isEmpty()) {
            logger.debug("Skipping {} at place {}: no PDGA number", name, placement);
            return Optional.empty();
        }

        return Optional.of(new ResultRow(placement, pdgaNumber.get(), name, tied));
    }

    private static Optional<Long> pdgaNumberFrom(final Element playerLink, final Element row) {
        final Matcher m = PLAYER_LINK_PATTERN.matcher(playerLink.attr("href"));
        String digits = m.find() ? m.group(1) : null;
        if (digits == null) {
            final Element pdgaCell = row.selectFirst("td.pdga-number");
            if (pdgaCell != null) {
                digits = StringUtils.trimToNull(StringUtils.getDigits(pdgaCell.text()));
            }
        }
        if (digits == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            logger.debug("Ignoring unreadable PDGA number '{}'", digits);
            return Optional.empty();
        }
    }
}
