package org.javai.unions.examples;

import org.javai.unions.*;
import org.javai.unions.ops.FailureReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Looks users up in an in-memory repository and turns absence into typed failures.
 */
class RepositoryLookupTest {

    record User(int id, String name, boolean active) {}

    static class UserRepository {
        private final Map<Integer, User> users = new HashMap<>();

        void save(User user) {
            users.put(user.id(), user);
        }

        Option<User> findById(int id) {
            return Option.ofNullable(users.get(id));
        }

        Option<User> findByName(String name) {
            return Options.firstOrNone(users.values(), user -> user.name().equals(name));
        }
    }

    private UserRepository repository;
    private List<Failure> reported;

    @BeforeEach
    void setUp() {
        repository = new UserRepository();
        repository.save(new User(1, "ann", true));
        repository.save(new User(2, "bob", false));
        reported = new ArrayList<>();
    }

    private Result<User> activeUser(int id) {
        FailureReporter reporter = reported::add;
        return repository.findById(id)
                .toResult(Failure.notFound("User.NotFound", "No user " + id, Map.of("id", id)))
                .ensure(User::active, Failure.conflict("User.Inactive", "User " + id + " is inactive"))
                .onFailure(reporter::report);
    }

    @Test
    void existingActiveUser_isFound() {
        assertThat(activeUser(1).map(User::name)).isEqualTo(Result.success("ann"));
        assertThat(reported).isEmpty();
    }

    @Test
    void missingUser_isNotFoundWithMetadata() {
        Result<User> user = activeUser(9);

        assertThat(user.getFailure().kind()).isEqualTo(FailureKind.NOT_FOUND);
        assertThat(user.getFailure().metadataValue("id")).isEqualTo(Option.some(9));
        assertThat(reported).containsExactly(user.getFailure());
    }

    @Test
    void inactiveUser_isConflict() {
        assertThat(activeUser(2).getFailure().code()).isEqualTo("User.Inactive");
    }

    @Test
    void optionalLookup_withDefault() {
        String name = repository.findByName("carol")
                .map(User::name)
                .getOrElse("guest");

        assertThat(name).isEqualTo("guest");
    }

    @Test
    void nameMustBeFree_beforeRegistering() {
        UnitResult free = repository.findByName("ann")
                .ensureNone(Failure.conflict("User.Exists", "Name already taken"));

        assertThat(free.getFailure().message()).isEqualTo("Name already taken");
        assertThat(repository.findByName("dora").ensureNone().isSuccess()).isTrue();
    }

    @Test
    void batchLookup_partitionsFoundAndMissing() {
        Results.Partition<User> partition = Results.partition(List.of(activeUser(1), activeUser(2), activeUser(3)));

        assertThat(partition.successes()).extracting(User::name).containsExactly("ann");
        assertThat(partition.failures()).extracting(Failure::code).containsExactly("User.Inactive", "User.NotFound");
    }
}
