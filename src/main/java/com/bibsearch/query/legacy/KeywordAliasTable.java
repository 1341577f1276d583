package com.bibsearch.query.legacy;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Legacy field keywords mapped to canonical field prefixes.
 * <p>
 * A keyword mapped to {@link #NO_FIELD} is noise: it is deleted and the words
 * following it are searched in all fields.
 */
public final class KeywordAliasTable {

    private KeywordAliasTable() {
    }

    public static final String NO_FIELD = "";

    public static final String AUTHOR = "author:";
    public static final String EXACT_AUTHOR = "exactauthor:";
    public static final String TITLE = "title:";
    public static final String KEYWORD = "keyword:";

    private static final String AFFILIATION = "700__u:";
    private static final String BULLETIN = "037__a:";
    private static final String REFERENCE = "reference:";
    private static final String COLLABORATION = "710__g:";
    private static final String CONFERENCE_NUMBER = "111__g:";
    private static final String COUNTRY = "044__a:";
    private static final String DATE = "269__c:";
    private static final String DATE_ADDED = "961__x:";
    private static final String DATE_UPDATED = "961__c:";
    private static final String FIRST_AUTHOR = "100__a:";
    private static final String EXPERIMENT = "experiment:";
    private static final String JOURNAL = "journal:";
    private static final String JOURNAL_PAGE = "773__c:";
    private static final String JOURNAL_YEAR = "773__y:";
    private static final String RECORD_KEY = "970__a:";
    private static final String NOTE = "500__a:";
    private static final String OLD_TITLE = "246__a:";
    private static final String SUBJECT = "650__a:";
    private static final String REPORT_NUMBER = "reportnumber:";
    private static final String TOPIC = "653__a:";

    /**
     * Keyword (lower case) to canonical field prefix.
     */
    public static final Map<String, String> ALIASES = Map.ofEntries(
            // affiliation
            Map.entry("affiliation", AFFILIATION),
            Map.entry("affil", AFFILIATION),
            Map.entry("aff", AFFILIATION),
            Map.entry("af", AFFILIATION),
            Map.entry("institution", AFFILIATION),
            Map.entry("inst", AFFILIATION),
            // any field
            Map.entry("any", "anyfield:"),
            // bulletin
            Map.entry("bb", BULLETIN),
            Map.entry("bbn", BULLETIN),
            Map.entry("bull", BULLETIN),
            Map.entry("bulletin-bd", BULLETIN),
            Map.entry("bulletin-bd-no", BULLETIN),
            Map.entry("eprint", BULLETIN),
            // citation / reference
            Map.entry("c", REFERENCE),
            Map.entry("citation", REFERENCE),
            Map.entry("cited", REFERENCE),
            Map.entry("jour-vol-page", REFERENCE),
            Map.entry("jvp", REFERENCE),
            // collaboration
            Map.entry("collaboration", COLLABORATION),
            Map.entry("collab-name", COLLABORATION),
            Map.entry("cn", COLLABORATION),
            // conference number
            Map.entry("conf-number", CONFERENCE_NUMBER),
            Map.entry("cnum", CONFERENCE_NUMBER),
            // country
            Map.entry("cc", COUNTRY),
            Map.entry("country", COUNTRY),
            // date
            Map.entry("date", DATE),
            Map.entry("d", DATE),
            // date added
            Map.entry("date-added", DATE_ADDED),
            Map.entry("dadd", DATE_ADDED),
            Map.entry("da", DATE_ADDED),
            // date updated
            Map.entry("date-updated", DATE_UPDATED),
            Map.entry("dupd", DATE_UPDATED),
            Map.entry("du", DATE_UPDATED),
            // first author
            Map.entry("fa", FIRST_AUTHOR),
            Map.entry("first-author", FIRST_AUTHOR),
            // author
            Map.entry("a", AUTHOR),
            Map.entry("au", AUTHOR),
            Map.entry("author", AUTHOR),
            Map.entry("name", AUTHOR),
            // exact author, rewritten to a literal author phrase later on
            Map.entry("ea", EXACT_AUTHOR),
            Map.entry("exact-author", EXACT_AUTHOR),
            // experiment
            Map.entry("exp", EXPERIMENT),
            Map.entry("experiment", EXPERIMENT),
            Map.entry("expno", EXPERIMENT),
            Map.entry("sd", EXPERIMENT),
            Map.entry("se", EXPERIMENT),
            // journal
            Map.entry("journal", JOURNAL),
            Map.entry("j", JOURNAL),
            Map.entry("published_in", JOURNAL),
            Map.entry("spicite", JOURNAL),
            Map.entry("vol", JOURNAL),
            // journal page
            Map.entry("journal-page", JOURNAL_PAGE),
            Map.entry("jp", JOURNAL_PAGE),
            // journal year
            Map.entry("journal-year", JOURNAL_YEAR),
            Map.entry("jy", JOURNAL_YEAR),
            // record key
            Map.entry("key", RECORD_KEY),
            Map.entry("irn", RECORD_KEY),
            Map.entry("record", RECORD_KEY),
            Map.entry("document", RECORD_KEY),
            Map.entry("documents", RECORD_KEY),
            // keywords
            Map.entry("k", KEYWORD),
            Map.entry("keywords", KEYWORD),
            // note
            Map.entry("note", NOTE),
            Map.entry("n", NOTE),
            // old title
            Map.entry("old-title", OLD_TITLE),
            Map.entry("old-t", OLD_TITLE),
            Map.entry("ex-ti", OLD_TITLE),
            Map.entry("et", OLD_TITLE),
            // ppf subject / status
            Map.entry("ppf-subject", SUBJECT),
            Map.entry("ps", SUBJECT),
            Map.entry("scl", SUBJECT),
            Map.entry("status", SUBJECT),
            // report number
            Map.entry("r", REPORT_NUMBER),
            Map.entry("rn", REPORT_NUMBER),
            Map.entry("rept", REPORT_NUMBER),
            Map.entry("report", REPORT_NUMBER),
            Map.entry("report-num", REPORT_NUMBER),
            // title
            Map.entry("t", TITLE),
            Map.entry("ti", TITLE),
            Map.entry("title", TITLE),
            Map.entry("with-language", TITLE),
            // topic
            Map.entry("topic", TOPIC),
            Map.entry("tp", TOPIC),
            Map.entry("hep-topic", TOPIC),
            Map.entry("desy-keyword", TOPIC),
            Map.entry("dk", TOPIC),

            // keywords without a canonical field
            // category
            Map.entry("arx", NO_FIELD),
            Map.entry("category", NO_FIELD),
            // coden
            Map.entry("bc", NO_FIELD),
            Map.entry("browse-only-indx", NO_FIELD),
            Map.entry("coden", NO_FIELD),
            Map.entry("journal-coden", NO_FIELD),
            // energy
            Map.entry("e", NO_FIELD),
            Map.entry("energy", NO_FIELD),
            Map.entry("energyrange-code", NO_FIELD),
            // exact experiment number
            Map.entry("ee", NO_FIELD),
            Map.entry("exact-exp", NO_FIELD),
            Map.entry("exact-expno", NO_FIELD),
            // field code
            Map.entry("f", NO_FIELD),
            Map.entry("fc", NO_FIELD),
            Map.entry("field", NO_FIELD),
            Map.entry("field-code", NO_FIELD),
            // hidden note
            Map.entry("hidden-note", NO_FIELD),
            Map.entry("hn", NO_FIELD),
            // ppf
            Map.entry("ppf", NO_FIELD),
            Map.entry("ppflist", NO_FIELD),
            // primarch
            Map.entry("parx", NO_FIELD),
            Map.entry("primarch", NO_FIELD),
            // slac topics
            Map.entry("ppfa", NO_FIELD),
            Map.entry("slac-topics", NO_FIELD),
            Map.entry("special-topics", NO_FIELD),
            Map.entry("stp", NO_FIELD),
            // test index
            Map.entry("test", NO_FIELD),
            Map.entry("testindex", NO_FIELD),
            // texkey
            Map.entry("texkey", NO_FIELD),
            // type code
            Map.entry("tc", NO_FIELD),
            Map.entry("ty", NO_FIELD),
            Map.entry("type", NO_FIELD),
            Map.entry("type-code", NO_FIELD)
    );

    /**
     * Look up a keyword, ignoring case.
     *
     * @return Canonical prefix, {@link #NO_FIELD} for noise keywords, or empty if unknown
     */
    public static Optional<String> lookup(String keyword) {
        return Optional.ofNullable(ALIASES.get(keyword.toLowerCase(Locale.ROOT)));
    }
}
