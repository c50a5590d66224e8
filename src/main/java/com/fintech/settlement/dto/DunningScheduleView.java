package com.fintech.settlement.dto;

import com.fintech.settlement.entity.DunningSchedule;
import com.fintech.settlement.entity.RenewalAttempt;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DunningScheduleView {

    private DunningSchedule schedule;
    private List<RenewalAttempt> attempts;
}
