package com.beadhub.test.domain;

import com.beadhub.domain.project.service.WorkspaceNamingDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

public class WorkspaceNamingDomainServiceTest {

    private final WorkspaceNamingDomainService service = new WorkspaceNamingDomainService();

    @Test
    public void shouldValidateSlugAliasAndHumanName() {
        Assertions.assertTrue(service.isValidProjectSlug("my-project"));
        Assertions.assertFalse(service.isValidProjectSlug("-leading"));
        Assertions.assertFalse(service.isValidProjectSlug("Upper"));
        Assertions.assertTrue(service.isValidAlias("alice-dev_2"));
        Assertions.assertFalse(service.isValidAlias("_alice"));
        Assertions.assertTrue(service.isValidHumanName("Ada O'Brien"));
        Assertions.assertFalse(service.isValidHumanName("1ada"));
    }

    @Test
    public void shouldNormalizeRole() {
        Assertions.assertEquals("code reviewer", service.normalizeRole("  Code   Reviewer "));
        Assertions.assertNull(service.normalizeRole("one two three"));
        Assertions.assertNull(service.normalizeRole("bad!role"));
        Assertions.assertNull(service.normalizeRole(" "));
    }

    @Test
    public void shouldSuggestFirstFreeClassicAlias() {
        Set<String> taken = new HashSet<>();
        taken.add("alice-developer");

        Assertions.assertEquals("bob-developer", service.suggestAlias("developer", taken));
        Assertions.assertEquals("alice", service.suggestAlias(null, new HashSet<>()));
    }

    @Test
    public void shouldFallBackToNumberedAliasWhenClassicNamesTaken() {
        Set<String> taken = new HashSet<>();
        for (String name : new String[]{"alice", "bob", "charlie", "dave", "eve", "frank", "grace", "henry", "ivy",
                "jack", "kate", "leo", "mia", "noah", "olivia", "peter", "quinn", "rose", "sam", "tara", "uma",
                "victor", "wendy", "xavier", "yara", "zoe"}) {
            taken.add(name + "-dev");
        }

        Assertions.assertEquals("alice-dev-02", service.suggestAlias("dev", taken));
    }
}
