package com.sectune.core.classifier;

import com.sectune.core.model.ThreatCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed keyword tables used by {@link SecurityClassifier}.
 * <p>
 * All terms are lower-case and matched by plain substring containment, so short
 * tokens that occur inside everyday words are deliberately absent.
 */
public final class SecurityVocabulary {

    /** Category → patterns. Iteration order is declaration order. */
    public static final Map<ThreatCategory, List<String>> CATEGORY_PATTERNS;

    /** General security terms that raise relevance without pointing at a category. */
    private static final List<String> GENERAL_TERMS = List.of(
            "security", "threat", "attack", "hash", "encryption", "authentication",
            "password", "incident", "forensic", "siem", "mitigation",
            "indicator of compromise", "antivirus", "endpoint", "cyber", "hacker",
            "compromised", "suspicious", "vpn", "privilege escalation"
    );

    /** Every term counted towards the keyword match count. */
    public static final Set<String> KEYWORDS;

    static {
        var patterns = new LinkedHashMap<ThreatCategory, List<String>>();
        patterns.put(ThreatCategory.MALWARE, List.of(
                "malware", "virus", "trojan", "ransomware", "worm", "spyware",
                "rootkit", "keylogger", "botnet", "backdoor", "quarantine"));
        patterns.put(ThreatCategory.PHISHING, List.of(
                "phishing", "spoofed", "fake login", "credential harvesting",
                "suspicious link", "malicious attachment", "lookalike domain"));
        patterns.put(ThreatCategory.NETWORK_INTRUSION, List.of(
                "intrusion", "unauthorized access", "port scan", "brute force",
                "lateral movement", "ddos", "firewall", "command and control"));
        patterns.put(ThreatCategory.VULNERABILITY, List.of(
                "vulnerability", "cve", "exploit", "zero-day", "security patch",
                "sql injection", "xss", "buffer overflow", "remote code execution",
                "misconfiguration"));
        patterns.put(ThreatCategory.DATA_BREACH, List.of(
                "data breach", "breach", "exfiltration", "data leak",
                "leaked credentials", "personal data", "data loss"));
        patterns.put(ThreatCategory.SOCIAL_ENGINEERING, List.of(
                "social engineering", "pretexting", "vishing", "smishing",
                "baiting", "tailgating", "impersonation"));
        CATEGORY_PATTERNS = Collections.unmodifiableMap(patterns);

        var keywords = new LinkedHashSet<String>(GENERAL_TERMS);
        patterns.values().forEach(keywords::addAll);
        KEYWORDS = Set.copyOf(keywords);
    }

    private SecurityVocabulary() {} // utility class
}
