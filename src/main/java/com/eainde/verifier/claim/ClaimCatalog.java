package com.eainde.verifier.claim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named claims that can be verified without going through a parsing front end.
 */
public class ClaimCatalog {

    private final Map<String, Claim> claims = new LinkedHashMap<>();

    public ClaimCatalog(List<? extends Claim> claims) {
        for (Claim claim : claims) {
            if (this.claims.putIfAbsent(claim.name(), claim) != null) {
                throw new IllegalArgumentException("Duplicate claim name: " + claim.name());
            }
        }
    }

    /** The built-in examples. */
    public static ClaimCatalog defaults() {
        List<Claim> claims = new ArrayList<>();

        claims.add(SeriesBoundClaim.builder("series_1")
                .formula("(2*d+1)/(2*h^2*(1+d*(d+1)/(h^2))*(1+d*(d+1)/(h^2*m^2))^2)")
                .index("d")
                .variables("{h,m}")
                .bounds("0", "Infinity")
                .conditions("h > 1 && m > 1")
                .bound("1+Log[m^2]")
                .build());

        claims.add(SeriesBoundClaim.builder("series_2")
                .formula("2^(((d/p) + 1 - a)*j)*Integrate[Exp[-2^j*s]*s^a/(1 + s^(2*a)), {s, 0, Infinity}]")
                .index("j")
                .variables("{a,d,p}")
                .bounds("-Infinity", "Infinity")
                .conditions("d>1 && p>1 && a>d/p")
                .bound("1")
                .build());

        claims.add(SeriesBoundClaim.builder("p_series")
                .formula("1/d^4")
                .index("d")
                .bounds("1", "Infinity")
                .bound("1")
                .build());

        claims.add(InequalityClaim.of("inequality_1", "{x,y}", "{x>0, y>1}", "x*y", "y*Log[y]+Exp[x]"));
        claims.add(InequalityClaim.of("inequality_2", "x,y,z", "x>0, y>0, z>0", "(x*y*z)^(1/3)", "(x+y+z)/3"));
        claims.add(InequalityClaim.of("inequality_3", "x,y,z", "x>0, y>0", "(x*y)^(1/2)", "(x+y)/2"));
        // false for every constant
        claims.add(InequalityClaim.of("inequality_4", "x", "x>1", "x^2", "x"));

        return new ClaimCatalog(claims);
    }

    public Optional<Claim> find(String name) {
        return Optional.ofNullable(claims.get(name));
    }

    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(claims.keySet()));
    }
}
