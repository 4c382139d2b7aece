package com.eainde.verifier.oracle.llm;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Subdomain agent - covers the domain of an inequality with simple subdomains on
 * which the comparison is trivial.
 */
public interface InequalitySubdomainAgent {

    @SystemMessage("""
        You decompose domains for an automatic inequality checker.

        GUIDING PRINCIPLES:
        - Be precise, avoid conflicting instructions.
        - Use natural subdomains so the inequality proof is trivial.
        - Minimize the number of subdomains while covering the whole domain.
        - Output only Mathematica-parsable inequalities using <, >, <=, >=, &&, Log[], Exp[].
        """)
    @UserMessage("""
        Given domain: {{domain}}
        Variables: {{variables}}
        Inequality: {{lhs}} <= {{rhs}}

        Return a list of subdomains whose union is the domain and on which the proof is trivial.
        Find the simplest subdomains. Prioritize simplicity.

        OUTPUT FORMAT:
        {{format}}
        """)
    String proposeSubdomains(@V("domain") String domain,
                             @V("variables") String variables,
                             @V("lhs") String lhs,
                             @V("rhs") String rhs,
                             @V("format") String format);
}
