package com.maildesk.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Loyalty program member
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Member {

    private String ffnum;
    private String email;
    private String title;
    private String fname;
    private String lname;
    private String tier;

    public String getDisplayName() {
        StringBuilder sb = new StringBuilder();
        if (fname != null && !fname.isBlank()) sb.append(fname.trim());
        if (lname != null && !lname.isBlank()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(lname.trim());
        }
        return sb.toString();
    }
}
