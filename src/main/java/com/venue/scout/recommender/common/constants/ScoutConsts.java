package com.venue.scout.recommender.common.constants;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Fixed constants that are not product-tuning knobs. Tunable values live in the
 * {@code scout.*} configuration properties.
 */
public interface ScoutConsts {

    interface Geo {
        double EARTH_RADIUS_MILES = 3959.0;
        double METERS_PER_MILE = 1609.34;
        // ~1.1 km cells for pool cache keys
        int CELL_DECIMALS = 2;
    }

    interface Categories {
        String OTHER = "other";
        String LIVE_MUSIC = "live music";
        String EVENTS = "events";
    }

    interface Reasons {
        String DECLINED = "declined";
        String NOT_INTERESTED = "not_interested";
        String BLOCKED = "User chose \"Never show again\"";
    }

    interface Keys {
        String POOL = "pool:";
        String GEOCODE = "geo:";
        String FORCE_REFRESH = "refresh:force:";
    }

    /**
     * Chains and utility places that never make a good outing suggestion.
     */
    List<Pattern> GENERIC_PLACE_PATTERNS = List.of(
            Pattern.compile("\\b(walmart|target|costco|sam'?s club|best buy|home depot|lowe'?s|ikea)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(kroger|safeway|albertsons|publix|aldi|whole foods|trader joe'?s|7-eleven)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(mcdonald'?s|burger king|wendy'?s|taco bell|kfc|subway|domino'?s|pizza hut|popeyes|arby'?s)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(shell|chevron|exxon|mobil|bp|texaco|valero|citgo|gas station)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(cvs|walgreens|rite aid|pharmacy|drugstore)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(bank|credit union|atm|chase|wells fargo|bank of america|citibank)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(church|chapel|mosque|synagogue|temple|cathedral)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(post office|ups store|fedex|dmv|laundromat|dry clean(ers|ing)|car wash|auto repair|storage)\\b", Pattern.CASE_INSENSITIVE)
    );
}
