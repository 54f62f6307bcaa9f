package io.checkpoint.subscription;

import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Conjunctive filter for {@link SubscriptionStore#findByCriteria(SubscriptionCriteria)}.
 *
 * <p>Each filter is optional; an absent filter matches every row. A filter set to an
 * empty collection matches no row.
 *
 * <pre>{@code
 * SubscriptionCriteria.all()
 *     .withGroups(SubscriptionGroup.of("projections"))
 *     .withStatuses(Status.ACTIVE, Status.ERROR);
 * }</pre>
 */
public final class SubscriptionCriteria {

    private static final SubscriptionCriteria ALL = new SubscriptionCriteria(null, null, null);

    private final Set<SubscriptionId> ids;
    private final Set<SubscriptionGroup> groups;
    private final Set<Status> statuses;

    private SubscriptionCriteria(Set<SubscriptionId> ids, Set<SubscriptionGroup> groups, Set<Status> statuses) {
        this.ids = ids;
        this.groups = groups;
        this.statuses = statuses;
    }

    /**
     * Criteria without any filter.
     */
    public static SubscriptionCriteria all() {
        return ALL;
    }

    public SubscriptionCriteria withIds(Collection<SubscriptionId> ids) {
        return new SubscriptionCriteria(Set.copyOf(ids), groups, statuses);
    }

    public SubscriptionCriteria withIds(SubscriptionId... ids) {
        return withIds(Arrays.asList(ids));
    }

    public SubscriptionCriteria withGroups(Collection<SubscriptionGroup> groups) {
        return new SubscriptionCriteria(ids, Set.copyOf(groups), statuses);
    }

    public SubscriptionCriteria withGroups(SubscriptionGroup... groups) {
        return withGroups(Arrays.asList(groups));
    }

    public SubscriptionCriteria withStatuses(Collection<Status> statuses) {
        return new SubscriptionCriteria(ids, groups, Set.copyOf(statuses));
    }

    public SubscriptionCriteria withStatuses(Status... statuses) {
        return withStatuses(Arrays.asList(statuses));
    }

    public Optional<Set<SubscriptionId>> ids() {
        return Optional.ofNullable(ids);
    }

    public Optional<Set<SubscriptionGroup>> groups() {
        return Optional.ofNullable(groups);
    }

    public Optional<Set<Status>> statuses() {
        return Optional.ofNullable(statuses);
    }

    /**
     * Returns {@code true} if some filter is an empty set, so no row can match.
     */
    public boolean matchesNothing() {
        return (ids != null && ids.isEmpty())
                || (groups != null && groups.isEmpty())
                || (statuses != null && statuses.isEmpty());
    }

    /**
     * Evaluates the criteria against a single subscription.
     */
    public boolean matches(Subscription subscription) {
        return (ids == null || ids.contains(subscription.id()))
                && (groups == null || groups.contains(subscription.group()))
                && (statuses == null || statuses.contains(subscription.status()));
    }

    @Override
    public String toString() {
        return "SubscriptionCriteria{ids=" + ids + ", groups=" + groups + ", statuses=" + statuses + '}';
    }
}
