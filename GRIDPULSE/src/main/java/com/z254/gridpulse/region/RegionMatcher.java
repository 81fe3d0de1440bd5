package com.z254.gridpulse.region;

import com.z254.gridpulse.domain.model.RegionInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves free-text region mentions to one of the supported regions.
 *
 * <p>A mention matches by region code, English name, local name or alias,
 * case-insensitively, or when it contains one of those names.
 */
@Component
@Slf4j
public class RegionMatcher {

    private static final List<RegionInfo> REGIONS = List.of(
            region("BJ", "Beijing", "北京", 39.9042, 116.4074, 10000),
            region("SH", "Shanghai", "上海", 31.2304, 121.4737, 12000),
            region("GZ", "Guangzhou", "广州", 23.1291, 113.2644, 8000),
            region("SZ", "Shenzhen", "深圳", 22.5431, 114.0579, 9000),
            region("HZ", "Hangzhou", "杭州", 30.2741, 120.1551, 6000),
            region("CD", "Chengdu", "成都", 30.6624, 104.0633, 7000),
            region("WH", "Wuhan", "武汉", 30.5928, 114.3055, 6500),
            region("XA", "Xi'an", "西安", 34.3416, 108.9398, 5500),
            region("NJ", "Nanjing", "南京", 32.0603, 118.7969, 5800),
            region("TJ", "Tianjin", "天津", 39.3434, 117.3616, 7500));

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("帝都", "BJ"),
            Map.entry("peking", "BJ"),
            Map.entry("魔都", "SH"),
            Map.entry("羊城", "GZ"),
            Map.entry("花城", "GZ"),
            Map.entry("canton", "GZ"),
            Map.entry("鹏城", "SZ"),
            Map.entry("杭城", "HZ"),
            Map.entry("蓉城", "CD"),
            Map.entry("江城", "WH"),
            Map.entry("古都", "XA"),
            Map.entry("xian", "XA"),
            Map.entry("金陵", "NJ"),
            Map.entry("津门", "TJ"));

    // Lower-cased name or alias -> region code; codes are matched separately
    private final Map<String, String> names = new LinkedHashMap<>();
    private final Map<String, RegionInfo> byCode = new LinkedHashMap<>();

    public RegionMatcher() {
        for (RegionInfo region : REGIONS) {
            byCode.put(region.getCode(), region);
            names.put(region.getName().toLowerCase(Locale.ROOT), region.getCode());
            names.put(region.getLocalName(), region.getCode());
        }
        ALIASES.forEach(names::put);
        log.info("RegionMatcher initialized with {} regions", byCode.size());
    }

    /**
     * Match a region mention.
     *
     * @param mention a name, code or alias as written by the user; may be null
     * @return the region, or empty when the mention names no supported region
     */
    public Optional<RegionInfo> match(String mention) {
        if (mention == null || mention.isBlank()) {
            return Optional.empty();
        }
        String normalized = mention.trim();
        RegionInfo byExactCode = byCode.get(normalized.toUpperCase(Locale.ROOT));
        if (byExactCode != null) {
            return Optional.of(byExactCode);
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        String code = names.get(lower);
        if (code == null) {
            code = findContainedName(lower);
        }
        return Optional.ofNullable(code).map(byCode::get);
    }

    /**
     * Find the first supported region named anywhere in a free-text query.
     */
    public Optional<RegionInfo> findInText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(findContainedName(text.toLowerCase(Locale.ROOT))).map(byCode::get);
    }

    public Optional<RegionInfo> byCode(String code) {
        return Optional.ofNullable(code).map(c -> byCode.get(c.toUpperCase(Locale.ROOT)));
    }

    public List<RegionInfo> supportedRegions() {
        return new ArrayList<>(byCode.values());
    }

    /**
     * Display names of the supported regions, for error messages.
     */
    public List<String> supportedNames() {
        return byCode.values().stream().map(RegionInfo::getName).toList();
    }

    private String findContainedName(String lowerText) {
        for (Map.Entry<String, String> entry : names.entrySet()) {
            if (lowerText.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static RegionInfo region(String code, String name, String localName,
                                     double latitude, double longitude, double baseLoad) {
        return RegionInfo.builder()
                .code(code)
                .name(name)
                .localName(localName)
                .latitude(latitude)
                .longitude(longitude)
                .baseLoad(baseLoad)
                .build();
    }
}
