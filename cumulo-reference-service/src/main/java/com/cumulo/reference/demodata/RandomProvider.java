package com.cumulo.reference.demodata;

import java.time.LocalDate;
import java.util.Random;

interface RandomProvider {
    Random forDay(LocalDate day);
}
