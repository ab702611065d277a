package com.ospicorp.capacityforecast.selection;

import com.ospicorp.capacityforecast.metrics.ModelScore;
import java.util.List;

public record Selection(ModelScore winner, List<ModelScore> ranking) {}
