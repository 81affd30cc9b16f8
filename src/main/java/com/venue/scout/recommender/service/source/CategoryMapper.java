package com.venue.scout.recommender.service.source;

import com.venue.scout.recommender.common.constants.ScoutConsts;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps provider vocabularies (place types, OSM tags, event segments) onto canonical categories
 * and back onto provider query types.
 */
@Component
public class CategoryMapper {

    // canonical category -> Places types queried for it, in default query order
    private static final Map<String, List<String>> PLACE_GROUPS = new LinkedHashMap<>();
    private static final Map<String, String> PLACE_TYPE_TO_CATEGORY = new LinkedHashMap<>();
    private static final Map<String, String> OSM_TAG_TO_CATEGORY = new LinkedHashMap<>();
    private static final Map<String, String> ALIASES = new LinkedHashMap<>();

    static {
        PLACE_GROUPS.put("dining", List.of("restaurant"));
        PLACE_GROUPS.put("coffee", List.of("cafe", "bakery"));
        PLACE_GROUPS.put("outdoor", List.of("park", "tourist_attraction"));
        PLACE_GROUPS.put("bars", List.of("bar"));
        PLACE_GROUPS.put("nightlife", List.of("night_club"));
        PLACE_GROUPS.put("culture", List.of("museum", "library"));
        PLACE_GROUPS.put("arts", List.of("art_gallery"));
        PLACE_GROUPS.put("entertainment", List.of("movie_theater", "bowling_alley", "amusement_park"));
        PLACE_GROUPS.put("fitness", List.of("gym"));
        PLACE_GROUPS.put("shopping", List.of("shopping_mall", "book_store"));
        PLACE_GROUPS.put("wellness", List.of("spa"));
        PLACE_GROUPS.put("family", List.of("zoo", "aquarium"));

        PLACE_GROUPS.forEach((cat, types) -> types.forEach(t -> PLACE_TYPE_TO_CATEGORY.put(t, cat)));

        OSM_TAG_TO_CATEGORY.put("amenity=restaurant", "dining");
        OSM_TAG_TO_CATEGORY.put("amenity=cafe", "coffee");
        OSM_TAG_TO_CATEGORY.put("amenity=bar", "bars");
        OSM_TAG_TO_CATEGORY.put("amenity=pub", "bars");
        OSM_TAG_TO_CATEGORY.put("amenity=nightclub", "nightlife");
        OSM_TAG_TO_CATEGORY.put("amenity=cinema", "entertainment");
        OSM_TAG_TO_CATEGORY.put("amenity=theatre", "entertainment");
        OSM_TAG_TO_CATEGORY.put("amenity=arts_centre", "arts");
        OSM_TAG_TO_CATEGORY.put("leisure=park", "outdoor");
        OSM_TAG_TO_CATEGORY.put("leisure=garden", "outdoor");
        OSM_TAG_TO_CATEGORY.put("leisure=fitness_centre", "fitness");
        OSM_TAG_TO_CATEGORY.put("tourism=museum", "culture");
        OSM_TAG_TO_CATEGORY.put("tourism=gallery", "arts");
        OSM_TAG_TO_CATEGORY.put("tourism=zoo", "family");

        ALIASES.put("cafe", "coffee");
        ALIASES.put("cafes", "coffee");
        ALIASES.put("restaurants", "dining");
        ALIASES.put("food", "dining");
        ALIASES.put("bar", "bars");
        ALIASES.put("parks", "outdoor");
        ALIASES.put("hiking", "outdoor");
        ALIASES.put("museums", "culture");
        ALIASES.put("art", "arts");
        ALIASES.put("movies", "entertainment");
        ALIASES.put("gym", "fitness");
        ALIASES.put("music", ScoutConsts.Categories.LIVE_MUSIC);
        ALIASES.put("concerts", ScoutConsts.Categories.LIVE_MUSIC);
    }

    /** Lower-cased canonical name of a free-text category or interest. */
    public String normalize(String raw) {
        if (raw == null) return ScoutConsts.Categories.OTHER;
        String s = raw.trim().toLowerCase(Locale.ROOT).replace('_', ' ');
        if (s.isEmpty()) return ScoutConsts.Categories.OTHER;
        return ALIASES.getOrDefault(s, s);
    }

    /** First Places type that maps to a known category wins. */
    public String fromPlaceTypes(Collection<String> types) {
        if (types == null) return ScoutConsts.Categories.OTHER;
        for (String t : types) {
            String cat = PLACE_TYPE_TO_CATEGORY.get(t);
            if (cat != null) return cat;
        }
        return ScoutConsts.Categories.OTHER;
    }

    public String fromOsmTags(Map<String, String> tags) {
        if (tags == null) return ScoutConsts.Categories.OTHER;
        for (Map.Entry<String, String> e : OSM_TAG_TO_CATEGORY.entrySet()) {
            String[] kv = e.getKey().split("=", 2);
            if (kv[1].equals(tags.get(kv[0]))) return e.getValue();
        }
        return ScoutConsts.Categories.OTHER;
    }

    public String fromEventSegment(String segment, String genre) {
        String s = segment == null ? "" : segment.toLowerCase(Locale.ROOT);
        if (s.contains("music")) return ScoutConsts.Categories.LIVE_MUSIC;
        if (s.contains("sport")) return "sports";
        if (s.contains("arts") || s.contains("theatre")) return "arts";
        if (s.contains("film")) return "entertainment";
        if (genre != null && genre.toLowerCase(Locale.ROOT).contains("comedy")) return "entertainment";
        return ScoutConsts.Categories.EVENTS;
    }

    /**
     * Places types to query for the given interests: groups matching an interest first, then the
     * default order, limited to {@code maxGroups} groups.
     */
    public List<String> placeTypesFor(Collection<String> interestHints, int maxGroups) {
        Set<String> groups = new LinkedHashSet<>();
        if (interestHints != null) {
            for (String hint : interestHints) {
                String cat = normalize(hint);
                if (PLACE_GROUPS.containsKey(cat)) groups.add(cat);
            }
        }
        groups.addAll(PLACE_GROUPS.keySet());

        List<String> types = new ArrayList<>();
        int taken = 0;
        for (String g : groups) {
            if (taken++ >= maxGroups) break;
            types.addAll(PLACE_GROUPS.get(g));
        }
        return types;
    }

    /** OSM key=value filters for the categories behind the interests, or all of them. */
    public List<String> osmFiltersFor(Collection<String> interestHints) {
        Set<String> wanted = new LinkedHashSet<>();
        if (interestHints != null) {
            for (String hint : interestHints) wanted.add(normalize(hint));
        }
        List<String> filters = new ArrayList<>();
        for (Map.Entry<String, String> e : OSM_TAG_TO_CATEGORY.entrySet()) {
            if (wanted.isEmpty() || wanted.contains(e.getValue())) filters.add(e.getKey());
        }
        if (filters.isEmpty()) filters.addAll(OSM_TAG_TO_CATEGORY.keySet());
        return filters;
    }

    public int groupCount() {
        return PLACE_GROUPS.size();
    }
}
