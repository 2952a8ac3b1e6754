package com.sitescope.crawler.crawl.robots;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parsed robots.txt: independent rule blocks per user-agent plus the declared sitemaps.
 */
public class RobotsDirectives {
  private static final String WILDCARD_AGENT = "*";

  private final Map<String, AgentRules> userAgents;
  private final List<String> sitemapUrls;
  private final Double crawlDelay;

  public RobotsDirectives(Map<String, AgentRules> userAgents, List<String> sitemapUrls, Double crawlDelay) {
    this.userAgents = userAgents;
    this.sitemapUrls = sitemapUrls;
    this.crawlDelay = crawlDelay;
  }

  public static RobotsDirectives empty() {
    return new RobotsDirectives(Map.of(), List.of(), null);
  }

  public Map<String, AgentRules> getUserAgents() {
    return Collections.unmodifiableMap(userAgents);
  }

  public List<String> getSitemapUrls() {
    return Collections.unmodifiableList(sitemapUrls);
  }

  public Double getCrawlDelay() {
    return crawlDelay;
  }

  @JsonIgnore
  public boolean hasRules() {
    return !userAgents.isEmpty();
  }

  public boolean isAllowed(String path) {
    return isAllowed(path, WILDCARD_AGENT);
  }

  /**
   * Checks the agent's own block first and falls back to {@code *}. A matching Disallow wins
   * unless a matching Allow is strictly longer. When a block has Allow lines but nothing in it
   * matched, the path counts as not allowed.
   */
  public boolean isAllowed(String path, String agent) {
    if (userAgents.isEmpty()) {
      return true;
    }
    String subject = path == null || path.isBlank() ? "/" : path;
    for (String candidate : agentsToCheck(agent)) {
      AgentRules rules = userAgents.get(candidate);
      if (rules == null) {
        continue;
      }

      for (String disallow : rules.disallow()) {
        if (!matches(subject, disallow)) {
          continue;
        }
        for (String allow : rules.allow()) {
          if (matches(subject, allow) && allow.length() > disallow.length()) {
            return true;
          }
        }
        return false;
      }

      if (!rules.allow().isEmpty()) {
        for (String allow : rules.allow()) {
          if (matches(subject, allow)) {
            return true;
          }
        }
        return false;
      }
    }
    return true;
  }

  public Double crawlDelayFor(String agent) {
    for (String candidate : agentsToCheck(agent)) {
      AgentRules rules = userAgents.get(candidate);
      if (rules != null && rules.crawlDelay() != null) {
        return rules.crawlDelay();
      }
    }
    return crawlDelay;
  }

  public static RobotsDirectives parse(String robotsText) {
    if (robotsText == null || robotsText.isBlank()) {
      return empty();
    }

    Map<String, MutableRules> agents = new LinkedHashMap<>();
    List<String> sitemaps = new ArrayList<>();
    Double lastCrawlDelay = null;
    String currentAgent = null;

    for (String rawLine : robotsText.split("\\R")) {
      String line = stripComment(rawLine).trim();
      if (line.isEmpty()) {
        continue;
      }
      int colonIdx = line.indexOf(':');
      if (colonIdx <= 0) {
        continue;
      }

      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      switch (key) {
        case "user-agent" -> {
          currentAgent = value.toLowerCase(Locale.ROOT);
          agents.computeIfAbsent(currentAgent, ignored -> new MutableRules());
        }
        case "disallow" -> {
          if (currentAgent != null) {
            agents.get(currentAgent).disallow.add(value);
          }
        }
        case "allow" -> {
          if (currentAgent != null) {
            agents.get(currentAgent).allow.add(value);
          }
        }
        case "crawl-delay" -> {
          Double delay = parseDelay(value);
          if (delay != null) {
            if (currentAgent != null) {
              agents.get(currentAgent).crawlDelay = delay;
            }
            lastCrawlDelay = delay;
          }
        }
        case "sitemap" -> {
          if (!value.isBlank() && !sitemaps.contains(value)) {
            sitemaps.add(value);
          }
        }
        default -> {
          // unknown directive
        }
      }
    }

    Map<String, AgentRules> frozen = new LinkedHashMap<>();
    agents.forEach((agent, rules) -> frozen.put(agent, rules.freeze()));
    return new RobotsDirectives(frozen, sitemaps, lastCrawlDelay);
  }

  /**
   * {@code *} matches any run of characters, a trailing {@code $} anchors the end, anything
   * else is a prefix match. Empty patterns never match.
   */
  static boolean matches(String path, String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      return false;
    }
    if (!pattern.contains("*") && !pattern.endsWith("$")) {
      return path.startsWith(pattern);
    }
    boolean anchored = pattern.endsWith("$");
    String body = anchored ? pattern.substring(0, pattern.length() - 1) : pattern;
    StringBuilder regex = new StringBuilder("^");
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == '*') {
        regex.append(".*");
      } else {
        regex.append(Pattern.quote(Character.toString(c)));
      }
    }
    if (anchored) {
      regex.append('$');
    }
    return Pattern.compile(regex.toString()).matcher(path).find();
  }

  private static List<String> agentsToCheck(String agent) {
    String normalized = agent == null || agent.isBlank() ? WILDCARD_AGENT : agent.trim().toLowerCase(Locale.ROOT);
    return WILDCARD_AGENT.equals(normalized) ? List.of(WILDCARD_AGENT) : List.of(normalized, WILDCARD_AGENT);
  }

  private static Double parseDelay(String value) {
    try {
      double parsed = Double.parseDouble(value);
      return parsed >= 0 ? parsed : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  public record AgentRules(List<String> disallow, List<String> allow, Double crawlDelay) {
  }

  private static final class MutableRules {
    private final List<String> disallow = new ArrayList<>();
    private final List<String> allow = new ArrayList<>();
    private Double crawlDelay;

    private AgentRules freeze() {
      return new AgentRules(List.copyOf(disallow), List.copyOf(allow), crawlDelay);
    }
  }
}
