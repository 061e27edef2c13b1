package com.doseobjectives.converter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The goals sharing one effective TemplateID, in the order their rows appear in the sheet.
 */
public final class TemplateGroup {

    private final String templateId;
    private final List<ClinicalGoal> goals = new ArrayList<>();

    public TemplateGroup(String templateId) {
        this.templateId = templateId;
    }

    public String getTemplateId() {
        return templateId;
    }

    /**
     * @param goal a goal whose effective TemplateID equals this group's id
     * @throws IllegalArgumentException if the goal belongs to another group
     */
    public void add(ClinicalGoal goal) {
        if (!templateId.equals(goal.getTemplateId())) {
            throw new IllegalArgumentException("Goal for template '" + goal.getTemplateId()
                    + "' added to group '" + templateId + "'");
        }
        goals.add(goal);
    }

    public List<ClinicalGoal> getGoals() {
        return Collections.unmodifiableList(goals);
    }

    /** Number of measure items this group expands to, one per goal alias. */
    public int getItemCount() {
        int count = 0;
        for (ClinicalGoal goal : goals) {
            count += goal.getAliases().size();
        }
        return count;
    }
}
