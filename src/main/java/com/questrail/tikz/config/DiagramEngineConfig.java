package com.questrail.tikz.config;

import com.questrail.tikz.group.MembershipPolicy;
import com.questrail.tikz.observability.DiagramObservabilitySink;
import com.questrail.tikz.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for a {@link com.questrail.tikz.core.DefaultDiagramEngine}.
 */
public record DiagramEngineConfig(
    LayoutPolicy layout,
    MembershipPolicy membershipPolicy,
    DiagramObservabilitySink observabilitySink
) {
    public DiagramEngineConfig {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(membershipPolicy, "membershipPolicy");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static DiagramEngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LayoutPolicy layout = LayoutPolicy.defaults();
        private MembershipPolicy membershipPolicy = MembershipPolicy.CENTER_CONTAINED;
        private DiagramObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withLayout(LayoutPolicy layout) {
            this.layout = layout;
            return this;
        }

        public Builder withMembershipPolicy(MembershipPolicy membershipPolicy) {
            this.membershipPolicy = membershipPolicy;
            return this;
        }

        public Builder withObservabilitySink(DiagramObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public DiagramEngineConfig build() {
            return new DiagramEngineConfig(layout, membershipPolicy, observabilitySink);
        }
    }
}
