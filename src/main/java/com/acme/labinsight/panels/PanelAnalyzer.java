/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Lab Insight Rules Engine
 */

package com.acme.labinsight.panels;

import com.acme.labinsight.AnalysisContext;
import com.acme.labinsight.model.Enums.PanelType;

public interface PanelAnalyzer {
    PanelType type();
    void run(AnalysisContext ctx, AnalysisResultBuilder out);
}
