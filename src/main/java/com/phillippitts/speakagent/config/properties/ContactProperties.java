package com.phillippitts.speakagent.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Seed entries for the built-in contact directory ({@code assistant.contacts.entries[n].*}).
 */
@ConfigurationProperties(prefix = "assistant.contacts")
public class ContactProperties {

    private List<Entry> entries = new ArrayList<>();

    public List<Entry> getEntries() {
        return entries;
    }

    public void setEntries(List<Entry> entries) {
        this.entries = entries;
    }

    /**
     * One contact. Owner {@code *} makes the contact visible to every owner.
     */
    public static class Entry {
        private String owner = "*";
        private String id;
        private String displayName;
        private List<String> aliases = new ArrayList<>();
        private String phone;

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getDisplayName() {
            return displayName;
        }

        public void setDisplayName(String displayName) {
            this.displayName = displayName;
        }

        public List<String> getAliases() {
            return aliases;
        }

        public void setAliases(List<String> aliases) {
            this.aliases = aliases;
        }

        public String getPhone() {
            return phone;
        }

        public void setPhone(String phone) {
            this.phone = phone;
        }
    }
}
