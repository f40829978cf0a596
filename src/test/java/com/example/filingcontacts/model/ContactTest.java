package com.example.filingcontacts.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class ContactTest {

    @Test
    void phonesFillSlotsInOrder() {
        Contact contact = new Contact();

        contact.setPhones(Arrays.asList("405-555-0001", "405-555-0002"));

        assertThat(contact.getPhone1()).isEqualTo("405-555-0001");
        assertThat(contact.getPhone2()).isEqualTo("405-555-0002");
        assertThat(contact.getPhone3()).isNull();
        assertThat(contact.getPhones()).containsExactly("405-555-0001", "405-555-0002");
    }

    @Test
    void settingFewerPhonesClearsOldSlots() {
        Contact contact = new Contact();
        contact.setPhones(Arrays.asList("1", "2", "3"));

        contact.setPhones(Collections.singletonList("9"));

        assertThat(contact.getPhones()).containsExactly("9");
    }

    @Test
    void emailsFillTwoSlots() {
        Contact contact = new Contact();

        contact.setEmails(Arrays.asList("a@x.com", "b@x.com", "c@x.com"));

        assertThat(contact.getEmail1()).isEqualTo("a@x.com");
        assertThat(contact.getEmail2()).isEqualTo("b@x.com");
    }
}
